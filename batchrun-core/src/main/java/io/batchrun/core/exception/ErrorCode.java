package io.batchrun.core.exception;

/// Classification of the validation failures raised by the core.
///
/// None of these are transient: callers report them and never retry.
///
/// @see BatchrunException
public enum ErrorCode {
    /// Specifier string does not match the grammar.
    INVALID_SYNTAX,
    /// A range in a specifier starts after it stops, or a value range is inverted.
    INVALID_RANGE,
    /// A literal in a specifier lies outside the declared value range.
    OUT_OF_RANGE,
    /// Time zone name is not a known IANA region.
    INVALID_TIMEZONE,
    /// Timestamp carries no offset or zone information.
    NAIVE_TIMESTAMP,
    /// Compact log metadata is malformed or of an unknown version.
    INVALID_METADATA,
    /// Job arguments do not satisfy the command's parameter schema or template.
    INVALID_ARGUMENTS,
    /// Retention policy delays are not ordered.
    INVALID_POLICY,
    /// Command kind is not one of the supported variants.
    UNKNOWN_COMMAND_KIND
}
