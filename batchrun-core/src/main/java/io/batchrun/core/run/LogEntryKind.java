package io.batchrun.core.run;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;

/// Output stream a log entry was read from.
///
/// The numeric codes are persisted and appear in compact log metadata.
public enum LogEntryKind {
    STDOUT(1),
    STDERR(2);

    private final int code;

    LogEntryKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /// Resolves a persisted code.
    ///
    /// @param code the stored value
    /// @return the kind, never null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_METADATA} for an unknown code
    public static LogEntryKind fromCode(int code) {
        for (LogEntryKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new BatchrunException(ErrorCode.INVALID_METADATA, "Unknown log entry kind: " + code);
    }
}
