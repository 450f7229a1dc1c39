package io.batchrun.core.execution;

import io.batchrun.core.command.Job;
import io.batchrun.core.run.JobRun;

/// Starts a run of a job without waiting for it to finish.
///
/// ### Contracts
/// - **Postcondition**: the returned run is stored with its start time set
/// - **Postcondition**: returns before the command completes
///
/// @see InProcessJobLauncher
@FunctionalInterface
public interface JobLauncher {

    /// Creates a run of `job` and starts executing it in the background.
    ///
    /// @param job the job to run, not null
    /// @return the created run, never null
    JobRun launch(Job job);
}
