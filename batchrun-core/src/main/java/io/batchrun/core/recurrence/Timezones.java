package io.batchrun.core.recurrence;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.time.ZoneId;
import java.util.Objects;

/// Validates and resolves IANA time zone names.
public final class Timezones {

    private Timezones() {}

    /// Resolves a region-based zone name such as `Europe/Helsinki`.
    ///
    /// Fixed offsets (`+02:00`) and abbreviations are rejected: a schedule must follow
    /// its region's daylight saving rules.
    ///
    /// @param name IANA name, not null
    /// @return the zone, never null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_TIMEZONE} if unknown
    public static ZoneId zoneOf(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!ZoneId.getAvailableZoneIds().contains(name)) {
            throw new BatchrunException(ErrorCode.INVALID_TIMEZONE, "Unknown time zone: " + name);
        }
        return ZoneId.of(name);
    }

    /// Returns whether the name denotes a known IANA region.
    ///
    /// @param name candidate name, may be null
    /// @return `true` if {@link #zoneOf(String)} would accept it
    public static boolean isValid(String name) {
        return name != null && ZoneId.getAvailableZoneIds().contains(name);
    }
}
