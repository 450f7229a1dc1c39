package io.batchrun.serialization.definitions;

import java.util.List;

/// Contents of a definitions file: commands, retention policies, jobs and scheduled jobs.
///
/// Missing sections are read as empty.
public record Definitions(
        List<CommandDefinition> commands,
        List<RetentionPolicyDefinition> retentionPolicies,
        List<JobDefinition> jobs,
        List<ScheduledJobDefinition> scheduledJobs) {

    public Definitions {
        commands = commands == null ? List.of() : List.copyOf(commands);
        retentionPolicies = retentionPolicies == null ? List.of() : List.copyOf(retentionPolicies);
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        scheduledJobs = scheduledJobs == null ? List.of() : List.copyOf(scheduledJobs);
    }
}
