package io.batchrun.core.command;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;

/// How a command's base argv is formed.
public enum CommandKind {
    /// A program on the `PATH` or an absolute path to an executable.
    EXECUTABLE("executable"),
    /// A subcommand of this application, invoked through the configured self command.
    MANAGED("managed");

    private final String value;

    CommandKind(String value) {
        this.value = value;
    }

    /// Returns the persisted name of the kind.
    public String value() {
        return value;
    }

    /// Resolves a persisted kind name.
    ///
    /// @param value stored name, not null
    /// @return the kind, never null
    /// @throws BatchrunException with {@link ErrorCode#UNKNOWN_COMMAND_KIND} if unknown
    public static CommandKind fromValue(String value) {
        for (CommandKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new BatchrunException(
                ErrorCode.UNKNOWN_COMMAND_KIND, "Unknown command kind: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
