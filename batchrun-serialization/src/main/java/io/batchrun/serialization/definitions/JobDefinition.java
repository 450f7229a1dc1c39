package io.batchrun.serialization.definitions;

import java.util.Map;

/// A job as written in a definitions file. The command and retention policy are
/// referenced by name; a missing policy means the default one.
public record JobDefinition(
        String name,
        String comment,
        String command,
        Map<String, Object> arguments,
        String retentionPolicy) {}
