package io.batchrun.core.command;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A named external invocation with a typed parameter schema.
///
/// The argv of a run is the base command followed by the rendered
/// {@link #parameterFormat()} (see {@link ArgvTemplate}):
///
/// | Kind | Base command |
/// |------|--------------|
/// | {@link CommandKind#EXECUTABLE} | `[name]` |
/// | {@link CommandKind#MANAGED} | `[selfCommand..., name]` |
///
/// @param id storage identifier, `0` before the command is saved
/// @param kind how the base command is formed, not null
/// @param name executable or subcommand name, not blank
/// @param parameters parameter schema keyed by parameter name, not null
/// @param parameterFormat argv template, may be empty, not null
public record JobCommand(
        long id,
        CommandKind kind,
        String name,
        Map<String, ParameterSpec> parameters,
        String parameterFormat) {

    public JobCommand {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        parameterFormat = parameterFormat == null ? "" : parameterFormat;
        ArgvTemplate.split(parameterFormat);
    }

    public JobCommand withId(long newId) {
        return new JobCommand(newId, kind, name, parameters, parameterFormat);
    }

    /// Checks an argument mapping against the parameter schema.
    ///
    /// @param arguments the job's arguments, not null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_ARGUMENTS} if a required parameter
    ///     is missing, an argument is not declared, a value has the wrong type, or the template
    ///     references an argument that is not supplied
    public void validateArguments(Map<String, ?> arguments) {
        Objects.requireNonNull(arguments, "arguments must not be null");
        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, ParameterSpec> p : new LinkedHashMap<>(parameters).entrySet()) {
            Object value = arguments.get(p.getKey());
            if (value == null) {
                if (p.getValue().required()) {
                    problems.add("missing required argument '" + p.getKey() + "'");
                }
            } else if (!p.getValue().type().accepts(value)) {
                problems.add(
                        "argument '" + p.getKey() + "' is not a valid " + p.getValue().type());
            }
        }
        for (String key : arguments.keySet()) {
            if (!parameters.containsKey(key)) {
                problems.add("unknown argument '" + key + "'");
            }
        }
        if (!problems.isEmpty()) {
            problems.sort(null);
            throw new BatchrunException(
                    ErrorCode.INVALID_ARGUMENTS,
                    "Invalid arguments for command " + name + ": " + String.join(", ", problems));
        }
        ArgvTemplate.render(parameterFormat, arguments);
    }

    /// Builds the argv for the given arguments.
    ///
    /// @param arguments values for the template, not null
    /// @param selfCommand argv prefix that re-invokes this application, used for managed
    ///     commands, not null
    /// @return the complete argv, never null or empty
    public List<String> commandLine(Map<String, ?> arguments, List<String> selfCommand) {
        List<String> argv = new ArrayList<>();
        if (kind == CommandKind.MANAGED) {
            argv.addAll(selfCommand);
        }
        argv.add(name);
        argv.addAll(ArgvTemplate.render(parameterFormat, arguments));
        return argv;
    }

    /// Renders as `kind: name template`.
    @Override
    public String toString() {
        return kind + ": " + name + (parameterFormat.isEmpty() ? "" : " " + parameterFormat);
    }
}
