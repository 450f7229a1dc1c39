package io.batchrun.core.recurrence;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import io.batchrun.core.intset.IntegerSetSpecifier;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Set;
import java.util.TreeMap;

/// A time zone plus six integer sets selecting wall-clock minutes.
///
/// The fields use fixed value ranges:
///
/// | Field | Range | Notes |
/// |-------|-------|-------|
/// | `years` | 1970-2200 | |
/// | `months` | 1-12 | |
/// | `daysOfMonth` | 1-31 | impossible dates such as Feb 30 are skipped |
/// | `weekdays` | 0-6 | Sunday = 0 |
/// | `hours` | 0-23 | |
/// | `minutes` | 0-59 | |
///
/// {@snippet :
/// RecurrenceRule nightly = RecurrenceRule.create("Europe/Helsinki", "*", "*", "*", "1-5", "2", "15");
/// for (ZonedDateTime t : nightly.nextEvents(Instant.now())) {
///     // ascending, infinite until 2200
/// }
/// }
///
/// ### DST policy
/// - **Unambiguous** local time: one timestamp
/// - **Ambiguous** local time (fall-back overlap): both interpretations when `hours` has
///   more than one member, otherwise only the daylight one
/// - **Non-existent** local time (spring-forward gap): the local time read with the offset
///   in force after the gap
///
/// Timestamps equal (as instants) to one emitted for the previous date are dropped, which
/// covers transitions at midnight.
///
/// @implNote Immutable and thread-safe. Equality is structural. Every call to
/// {@link Iterable#iterator()} on the result of {@link #nextEvents} restarts the sequence.
///
/// @param timezone the zone the rule is evaluated in, not null
/// @param years specifier over 1970-2200, not null
/// @param months specifier over 1-12, not null
/// @param daysOfMonth specifier over 1-31, not null
/// @param weekdays specifier over 0-6, not null
/// @param hours specifier over 0-23, not null
/// @param minutes specifier over 0-59, not null
/// @see LocalTimeResolution
public record RecurrenceRule(
        ZoneId timezone,
        IntegerSetSpecifier years,
        IntegerSetSpecifier months,
        IntegerSetSpecifier daysOfMonth,
        IntegerSetSpecifier weekdays,
        IntegerSetSpecifier hours,
        IntegerSetSpecifier minutes) {

    public static final int MIN_YEAR = 1970;
    public static final int MAX_YEAR = 2200;

    public RecurrenceRule {
        Objects.requireNonNull(timezone, "timezone must not be null");
        requireRange("years", years, MIN_YEAR, MAX_YEAR);
        requireRange("months", months, 1, 12);
        requireRange("daysOfMonth", daysOfMonth, 1, 31);
        requireRange("weekdays", weekdays, 0, 6);
        requireRange("hours", hours, 0, 23);
        requireRange("minutes", minutes, 0, 59);
    }

    /// Parses a rule from its six specifier strings.
    ///
    /// @param timezone IANA zone name, not null
    /// @return the rule, never null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_TIMEZONE} for an unknown zone,
    ///     or the specifier parse error for a malformed field
    public static RecurrenceRule create(
            String timezone,
            String years,
            String months,
            String daysOfMonth,
            String weekdays,
            String hours,
            String minutes) {
        return new RecurrenceRule(
                Timezones.zoneOf(timezone),
                new IntegerSetSpecifier(years, MIN_YEAR, MAX_YEAR),
                new IntegerSetSpecifier(months, 1, 12),
                new IntegerSetSpecifier(daysOfMonth, 1, 31),
                new IntegerSetSpecifier(weekdays, 0, 6),
                new IntegerSetSpecifier(hours, 0, 23),
                new IntegerSetSpecifier(minutes, 0, 59));
    }

    /// Returns whether the wall-clock date and time are selected by this rule.
    ///
    /// @param local the local date-time in {@link #timezone()}, not null
    /// @return `true` if every field matches
    public boolean matches(LocalDateTime local) {
        return matchesDate(local.toLocalDate())
                && hours.contains(local.getHour())
                && minutes.contains(local.getMinute());
    }

    /// Returns whether the date is selected by the year, month, day and weekday sets.
    ///
    /// @param date the local date, not null
    /// @return `true` if the date matches
    public boolean matchesDate(LocalDate date) {
        return years.contains(date.getYear())
                && months.contains(date.getMonthValue())
                && daysOfMonth.contains(date.getDayOfMonth())
                && matchesWeekday(date);
    }

    private boolean matchesWeekday(LocalDate date) {
        if (weekdays.isTotal()) {
            return true;
        }
        // DayOfWeek is Monday=1..Sunday=7; the rule counts Sunday as 0.
        return weekdays.contains(date.getDayOfWeek().getValue() % 7);
    }

    /// Returns the ascending sequence of event times at or after `start`.
    ///
    /// @param start offset- or zone-aware start time, not null
    /// @return a restartable lazy sequence, never null
    /// @throws BatchrunException with {@link ErrorCode#NAIVE_TIMESTAMP} if `start` carries no
    ///     offset
    public Iterable<ZonedDateTime> nextEvents(TemporalAccessor start) {
        Objects.requireNonNull(start, "start must not be null");
        if (!start.isSupported(ChronoField.INSTANT_SECONDS)) {
            throw new BatchrunException(
                    ErrorCode.NAIVE_TIMESTAMP, "Start time must be time zone aware: " + start);
        }
        Instant startInstant = Instant.from(start);
        return () -> new EventIterator(startInstant);
    }

    /// Returns the first `count` event times at or after `start`.
    ///
    /// @param start offset- or zone-aware start time, not null
    /// @param count maximum number of events, non-negative
    /// @return at most `count` events in ascending order, never null
    public List<ZonedDateTime> nextEvents(TemporalAccessor start, int count) {
        List<ZonedDateTime> events = new ArrayList<>(Math.max(count, 0));
        Iterator<ZonedDateTime> it = nextEvents(start).iterator();
        while (events.size() < count && it.hasNext()) {
            events.add(it.next());
        }
        return events;
    }

    private static void requireRange(
            String field, IntegerSetSpecifier spec, int minValue, int maxValue) {
        Objects.requireNonNull(spec, field + " must not be null");
        if (spec.minValue() != minValue || spec.maxValue() != maxValue) {
            throw new BatchrunException(
                    ErrorCode.OUT_OF_RANGE,
                    field + " must range over [" + minValue + ", " + maxValue + "], got ["
                            + spec.minValue() + ", " + spec.maxValue() + "]");
        }
    }

    private List<ZonedDateTime> candidates(LocalDateTime local) {
        LocalTimeResolution resolution = LocalTimeResolution.resolve(local, timezone);
        if (resolution instanceof LocalTimeResolution.Unambiguous u) {
            return List.of(u.time());
        }
        if (resolution instanceof LocalTimeResolution.NonExistent n) {
            return List.of(n.forward());
        }
        LocalTimeResolution.Ambiguous a = (LocalTimeResolution.Ambiguous) resolution;
        if (hours.size() <= 1) {
            return List.of(a.daylight());
        }
        List<ZonedDateTime> both = new ArrayList<>(2);
        for (ZonedDateTime candidate : List.of(a.daylight(), a.standard())) {
            if (matches(candidate.toLocalDateTime())) {
                both.add(candidate);
            }
        }
        return both;
    }

    /// Walks matching dates lazily and buffers the events of one date at a time.
    private final class EventIterator implements Iterator<ZonedDateTime> {

        private final Instant start;
        private final Iterator<LocalDate> dates;
        private final Deque<ZonedDateTime> buffer = new ArrayDeque<>();
        private Set<Instant> previousDay = Set.of();

        EventIterator(Instant start) {
            this.start = start;
            this.dates = new DateIterator(LocalDate.ofInstant(start, timezone));
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && dates.hasNext()) {
                fill(dates.next());
            }
            return !buffer.isEmpty();
        }

        @Override
        public ZonedDateTime next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.removeFirst();
        }

        private void fill(LocalDate date) {
            TreeMap<Instant, ZonedDateTime> day = new TreeMap<>();
            for (PrimitiveIterator.OfInt h = hours.intIterator(); h.hasNext(); ) {
                int hour = h.nextInt();
                for (PrimitiveIterator.OfInt m = minutes.intIterator(); m.hasNext(); ) {
                    LocalDateTime local = LocalDateTime.of(date, LocalTime.of(hour, m.nextInt()));
                    for (ZonedDateTime candidate : candidates(local)) {
                        Instant instant = candidate.toInstant();
                        if (!instant.isBefore(start)) {
                            day.putIfAbsent(instant, candidate);
                        }
                    }
                }
            }
            day.keySet().removeAll(previousDay);
            buffer.addAll(day.values());
            previousDay = new HashSet<>(day.keySet());
        }
    }

    /// Ascending matching dates from a start date, skipping impossible days of month.
    private final class DateIterator implements Iterator<LocalDate> {

        private final LocalDate startDate;
        private final PrimitiveIterator.OfInt yearIt = years.intIterator();
        private PrimitiveIterator.OfInt monthIt;
        private PrimitiveIterator.OfInt dayIt;
        private YearMonth currentMonth;
        private LocalDate next;

        DateIterator(LocalDate startDate) {
            this.startDate = startDate;
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public LocalDate next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            LocalDate result = next;
            advance();
            return result;
        }

        private void advance() {
            next = null;
            while (next == null) {
                if (dayIt != null && dayIt.hasNext()) {
                    int day = dayIt.nextInt();
                    if (!currentMonth.isValidDay(day)) continue;
                    LocalDate candidate = currentMonth.atDay(day);
                    if (!candidate.isBefore(startDate) && matchesWeekday(candidate)) {
                        next = candidate;
                    }
                } else if (monthIt != null && monthIt.hasNext()) {
                    YearMonth month = currentMonth.withMonth(monthIt.nextInt());
                    if (month.isBefore(YearMonth.from(startDate))) continue;
                    currentMonth = month;
                    dayIt = daysOfMonth.intIterator();
                } else if (yearIt.hasNext()) {
                    int year = yearIt.nextInt();
                    if (year < startDate.getYear()) continue;
                    currentMonth = YearMonth.of(year, 1);
                    monthIt = months.intIterator();
                    dayIt = null;
                } else {
                    return;
                }
            }
        }
    }
}
