package io.batchrun.core.command;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.time.Duration;
import java.util.Objects;

/// How long the history of a job's runs is kept.
///
/// All delays are measured from a run's start time. After `compactDelay` the
/// fine-grained log entries are compacted, after `deleteLogsDelay` all logs are
/// deleted and after `deleteRunDelay` the run itself is deleted.
///
/// ### Contracts
/// - **Invariant**: `0 <= compactDelay <= deleteLogsDelay <= deleteRunDelay`
///
/// @param identifier stable unique key, not blank
/// @param compactDelay delay before compaction, not null
/// @param deleteLogsDelay delay before log deletion, not null
/// @param deleteRunDelay delay before run deletion, not null
public record RetentionPolicy(
        String identifier,
        Duration compactDelay,
        Duration deleteLogsDelay,
        Duration deleteRunDelay) {

    public static final String DEFAULT_IDENTIFIER = "default";

    /// Two weeks until compaction, four years until log deletion, ten years until run deletion.
    public static final RetentionPolicy DEFAULT =
            new RetentionPolicy(
                    DEFAULT_IDENTIFIER,
                    Duration.ofDays(14),
                    Duration.ofDays(1461),
                    Duration.ofDays(3652));

    public RetentionPolicy {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(compactDelay, "compactDelay must not be null");
        Objects.requireNonNull(deleteLogsDelay, "deleteLogsDelay must not be null");
        Objects.requireNonNull(deleteRunDelay, "deleteRunDelay must not be null");
        if (identifier.isBlank()) {
            throw new BatchrunException(ErrorCode.INVALID_POLICY, "identifier must not be blank");
        }
        if (compactDelay.isNegative()
                || compactDelay.compareTo(deleteLogsDelay) > 0
                || deleteLogsDelay.compareTo(deleteRunDelay) > 0) {
            throw new BatchrunException(
                    ErrorCode.INVALID_POLICY,
                    "Retention delays of '" + identifier + "' must satisfy"
                            + " 0 <= compact <= delete logs <= delete run, got "
                            + compactDelay + ", " + deleteLogsDelay + ", " + deleteRunDelay);
        }
    }
}
