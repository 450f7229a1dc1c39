package io.batchrun.core.command;

import java.util.Objects;

/// Declaration of one command parameter.
///
/// @param type value type, not null
/// @param required whether every job must supply the parameter
/// @param description human readable description, may be empty, not null
public record ParameterSpec(ParameterType type, boolean required, String description) {

    public ParameterSpec {
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
    }

    public static ParameterSpec required(ParameterType type) {
        return new ParameterSpec(type, true, "");
    }

    public static ParameterSpec optional(ParameterType type) {
        return new ParameterSpec(type, false, "");
    }
}
