package io.batchrun.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Unchecked exception for parse and validation failures in the batchrun core.
///
/// Every instance carries an {@link ErrorCode} so callers (CLI commands,
/// definition loaders, the metadata codec) can branch on the failure kind
/// without parsing messages.
///
/// @see ErrorCode
public class BatchrunException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127360934471823290L;

    private final ErrorCode code;

    public BatchrunException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public BatchrunException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /// Returns the failure classification.
    ///
    /// @return the error code, never null
    public ErrorCode getCode() {
        return code;
    }
}
