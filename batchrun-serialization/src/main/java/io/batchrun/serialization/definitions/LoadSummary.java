package io.batchrun.serialization.definitions;

/// Number of definitions of each type stored by one {@link DefinitionsLoader#load} call.
public record LoadSummary(int commands, int retentionPolicies, int jobs, int scheduledJobs) {

    @Override
    public String toString() {
        return commands + " commands, " + retentionPolicies + " retention policies, "
                + jobs + " jobs, " + scheduledJobs + " scheduled jobs";
    }
}
