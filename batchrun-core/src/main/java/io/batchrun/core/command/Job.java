package io.batchrun.core.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A command bound to concrete arguments and a retention policy.
///
/// Arguments are validated against the command's schema at construction, so a
/// job that exists always renders to a deterministic argv.
///
/// @param id storage identifier, `0` before the job is saved
/// @param name descriptive unique name, not blank
/// @param comment free text, not null
/// @param command the command to run, not null
/// @param arguments values for the command's parameters, not null
/// @param retentionPolicy governs how long the history of runs is kept, not null
public record Job(
        long id,
        String name,
        String comment,
        JobCommand command,
        Map<String, Object> arguments,
        RetentionPolicy retentionPolicy) {

    public Job {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        Objects.requireNonNull(retentionPolicy, "retentionPolicy must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        comment = comment == null ? "" : comment;
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        command.validateArguments(arguments);
    }

    public Job withId(long newId) {
        return new Job(newId, name, comment, command, arguments, retentionPolicy);
    }

    /// Returns the argv of a run of this job.
    ///
    /// @param selfCommand argv prefix that re-invokes this application, not null
    /// @return the argv, never null
    public List<String> commandLine(List<String> selfCommand) {
        return command.commandLine(arguments, selfCommand);
    }

    @Override
    public String toString() {
        return name;
    }
}
