package io.batchrun.core.run;

import io.batchrun.core.command.RetentionPolicy;
import java.time.Instant;
import java.util.Objects;

/// A run together with its retention policy and whether it still has logs.
///
/// @param runId the run
/// @param startedAt the run's start time, not null
/// @param policy the retention policy of the run's job, not null
/// @param hasLogEntries whether fine-grained entries exist
/// @param hasCompactLog whether a compact log exists
public record RunRetention(
        long runId,
        Instant startedAt,
        RetentionPolicy policy,
        boolean hasLogEntries,
        boolean hasCompactLog) {

    public RunRetention {
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
    }

    public boolean hasLogs() {
        return hasLogEntries || hasCompactLog;
    }
}
