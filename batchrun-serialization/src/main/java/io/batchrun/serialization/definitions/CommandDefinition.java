package io.batchrun.serialization.definitions;

import io.batchrun.core.command.CommandKind;
import io.batchrun.core.command.JobCommand;
import io.batchrun.core.command.ParameterSpec;
import java.util.Map;

/// A command as written in a definitions file.
///
/// @param kind `executable` or `managed`
/// @param name program or subcommand name
/// @param parameters parameter schema, may be null
/// @param parameterFormat argv template, may be null
public record CommandDefinition(
        String kind, String name, Map<String, ParameterSpec> parameters, String parameterFormat) {

    JobCommand toCommand() {
        return new JobCommand(
                0,
                CommandKind.fromValue(kind),
                name,
                parameters == null ? Map.of() : parameters,
                parameterFormat == null ? "" : parameterFormat);
    }
}
