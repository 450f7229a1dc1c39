package io.batchrun.core.cleaning;

import io.batchrun.core.run.DeletionCounts;
import java.util.Objects;

/// Outcome of a history clean.
///
/// @param plan the planned actions, not null
/// @param dryRun whether the plan was only reported
/// @param deleted rows deleted, {@link DeletionCounts#NONE} for a dry run
public record CleaningReport(CleaningPlan plan, boolean dryRun, DeletionCounts deleted) {

    public CleaningReport {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(deleted, "deleted must not be null");
    }
}
