package io.batchrun.core.recurrence;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Objects;

/// Outcome of placing a wall-clock time in a time zone.
///
/// A local time maps to exactly one instant, to two instants inside a fall-back
/// overlap, or to none inside a spring-forward gap. {@link RecurrenceRule} decides
/// which of the candidates to emit based on the shape of the rule.
///
/// @see #resolve(LocalDateTime, ZoneId)
public sealed interface LocalTimeResolution
        permits LocalTimeResolution.Unambiguous,
                LocalTimeResolution.Ambiguous,
                LocalTimeResolution.NonExistent {

    /// The local time exists exactly once.
    record Unambiguous(ZonedDateTime time) implements LocalTimeResolution {
        public Unambiguous {
            Objects.requireNonNull(time, "time must not be null");
        }
    }

    /// The local time occurs twice, first under the daylight offset then under standard time.
    record Ambiguous(ZonedDateTime daylight, ZonedDateTime standard)
            implements LocalTimeResolution {
        public Ambiguous {
            Objects.requireNonNull(daylight, "daylight must not be null");
            Objects.requireNonNull(standard, "standard must not be null");
        }
    }

    /// The local time is skipped by a forward transition.
    ///
    /// `forward` is the wall-clock time read with the offset in force after the
    /// gap, rendered canonically in the zone.
    record NonExistent(ZonedDateTime forward) implements LocalTimeResolution {
        public NonExistent {
            Objects.requireNonNull(forward, "forward must not be null");
        }
    }

    /// Classifies a local date-time against the rules of a zone.
    ///
    /// @param local the wall-clock time, not null
    /// @param zone the zone to place it in, not null
    /// @return the resolution, never null
    static LocalTimeResolution resolve(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() == 1) {
            return new Unambiguous(ZonedDateTime.ofLocal(local, zone, offsets.get(0)));
        }
        if (offsets.size() == 2) {
            ZonedDateTime zoned = ZonedDateTime.ofLocal(local, zone, null);
            return new Ambiguous(
                    zoned.withEarlierOffsetAtOverlap(), zoned.withLaterOffsetAtOverlap());
        }
        ZoneOffsetTransition gap = rules.getTransition(local);
        return new NonExistent(
                ZonedDateTime.ofInstant(local.toInstant(gap.getOffsetAfter()), zone));
    }
}
