package io.batchrun.serialization.definitions;

import io.batchrun.core.command.RetentionPolicy;
import java.time.Duration;

/// A retention policy as written in a definitions file. Delays are ISO-8601 durations
/// such as `P14D`.
public record RetentionPolicyDefinition(
        String identifier,
        Duration compactDelay,
        Duration deleteLogsDelay,
        Duration deleteRunDelay) {

    RetentionPolicy toPolicy() {
        return new RetentionPolicy(identifier, compactDelay, deleteLogsDelay, deleteRunDelay);
    }
}
