package io.batchrun.core.command;

import java.util.List;
import java.util.Optional;

/// Storage of the definitions runs are made from: commands, retention policies and jobs.
///
/// Saves are upserts keyed by the natural key of each definition (command name,
/// policy identifier, job name), so loading the same definitions twice is a no-op.
///
/// @see InMemoryJobCatalog
public interface JobCatalog {

    /// Creates or replaces the command with the same name.
    ///
    /// @return the stored command with its identifier, never null
    JobCommand saveCommand(JobCommand command);

    Optional<JobCommand> findCommand(String name);

    /// Creates or replaces the policy with the same identifier.
    void saveRetentionPolicy(RetentionPolicy policy);

    Optional<RetentionPolicy> findRetentionPolicy(String identifier);

    /// Creates or replaces the job with the same name.
    ///
    /// The job's command and policy must already be stored.
    ///
    /// @return the stored job with its identifier, never null
    Job saveJob(Job job);

    Optional<Job> findJob(long jobId);

    Optional<Job> findJobByName(String name);

    List<Job> findAllJobs();
}
