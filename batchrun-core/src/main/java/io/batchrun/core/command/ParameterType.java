package io.batchrun.core.command;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/// Value type of a command parameter.
///
/// Dates and date-times travel as ISO-8601 strings because job arguments are
/// stored as JSON.
public enum ParameterType {
    STRING("string"),
    INT("int"),
    BOOL("bool"),
    DATE("date"),
    DATETIME("datetime");

    private final String value;

    ParameterType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /// Resolves a type name as written in a parameter schema.
    ///
    /// @param value the name, not null
    /// @return the type
    /// @throws IllegalArgumentException if the name is unknown
    public static ParameterType fromValue(String value) {
        for (ParameterType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + value);
    }

    /// Returns whether `argument` is a valid value of this type.
    ///
    /// @param argument the value from a job's argument mapping, may be null
    /// @return `true` if the value conforms
    public boolean accepts(Object argument) {
        if (argument == null) {
            return false;
        }
        switch (this) {
            case STRING:
                return argument instanceof String;
            case INT:
                return argument instanceof Integer
                        || argument instanceof Long
                        || argument instanceof Short
                        || argument instanceof BigInteger;
            case BOOL:
                return argument instanceof Boolean;
            case DATE:
                return argument instanceof String s && parses(() -> LocalDate.parse(s));
            case DATETIME:
                return argument instanceof String s && parses(() -> OffsetDateTime.parse(s));
            default:
                return false;
        }
    }

    private static boolean parses(Runnable parser) {
        try {
            parser.run();
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
