package io.batchrun.serialization.definitions;

import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.command.JobCommand;
import io.batchrun.core.command.RetentionPolicy;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.schedule.ScheduledJob;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Stores the contents of a definitions file.
///
/// Everything is upserted by name, in dependency order: commands, retention policies,
/// jobs, then scheduled jobs. Each scheduled job goes through {@link RunQueue#save} so its
/// queue window is regenerated right away.
///
/// ### Contracts
/// - **Precondition**: every referenced command, policy and job is either in the same file
///   or already stored
/// - **Postcondition**: definitions before the first failing one stay stored
///
/// @see io.batchrun.serialization.BatchrunSerializer#readDefinitions
public class DefinitionsLoader {

    private static final Logger logger = Logger.getLogger(DefinitionsLoader.class.getName());

    private final JobCatalog catalog;
    private final RunQueue runQueue;

    public DefinitionsLoader(JobCatalog catalog, RunQueue runQueue) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.runQueue = Objects.requireNonNull(runQueue, "runQueue must not be null");
    }

    /// Stores all definitions.
    ///
    /// @param definitions parsed file contents, not null
    /// @return counts of stored definitions, never null
    /// @throws IllegalArgumentException if a reference cannot be resolved
    /// @throws io.batchrun.core.exception.BatchrunException if a definition is invalid
    public LoadSummary load(Definitions definitions) {
        Objects.requireNonNull(definitions, "definitions must not be null");

        for (CommandDefinition command : definitions.commands()) {
            catalog.saveCommand(command.toCommand());
        }
        for (RetentionPolicyDefinition policy : definitions.retentionPolicies()) {
            catalog.saveRetentionPolicy(policy.toPolicy());
        }
        for (JobDefinition job : definitions.jobs()) {
            catalog.saveJob(toJob(job));
        }
        for (ScheduledJobDefinition scheduled : definitions.scheduledJobs()) {
            ScheduledJob saved =
                    runQueue.save(scheduled.toScheduledJob(resolveJob(scheduled.job())));
            logger.info("Saved " + saved);
        }

        LoadSummary summary =
                new LoadSummary(
                        definitions.commands().size(),
                        definitions.retentionPolicies().size(),
                        definitions.jobs().size(),
                        definitions.scheduledJobs().size());
        logger.info("Loaded " + summary);
        return summary;
    }

    private Job toJob(JobDefinition definition) {
        JobCommand command =
                catalog.findCommand(definition.command())
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unknown command: " + definition.command()));
        String policyName =
                definition.retentionPolicy() == null
                        ? RetentionPolicy.DEFAULT_IDENTIFIER
                        : definition.retentionPolicy();
        RetentionPolicy policy =
                catalog.findRetentionPolicy(policyName)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unknown retention policy: " + policyName));
        Map<String, Object> arguments =
                definition.arguments() == null ? Map.of() : definition.arguments();
        return new Job(0, definition.name(), definition.comment(), command, arguments, policy);
    }

    private Job resolveJob(String name) {
        return catalog.findJobByName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + name));
    }
}
