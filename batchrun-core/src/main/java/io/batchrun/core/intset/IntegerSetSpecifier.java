package io.batchrun.core.intset;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.StreamSupport;

/// A finite set of integers within `[minValue, maxValue]` described by a compact string.
///
/// The specifier string consists of comma separated parts. Each part is a single
/// number, a range `B-E`, or a star `*` covering the whole value range. Ranges and
/// stars may carry a step, `B-E/S`, meaning the values `B + n*S` for `n >= 0` that
/// do not exceed `E`. A stepped star starts from the first multiple of the step
/// that is at least `minValue`.
///
/// ### Grammar
/// ```
/// spec  := part ("," part)*
/// part  := number | range
/// range := ("*" | number "-" number) ("/" number)?
/// ```
///
/// {@snippet :
/// var hours = new IntegerSetSpecifier("*/6,13", 0, 23);
/// hours.contains(12);   // true
/// hours.size();         // 5
/// hours.stream().boxed().toList();  // [0, 6, 12, 13, 18]
/// }
///
/// ### Contracts
/// - **Invariant**: iteration is strictly ascending and yields exactly {@link #size()} values
/// - **Invariant**: a value is iterated iff {@link #contains(int)} holds for it
/// - **Invariant**: equality is structural on `(spec, minValue, maxValue)`, not on the set
///
/// @implNote Immutable and thread-safe. When the component ranges are disjoint
/// (checked once at construction) iteration walks each range lazily, so reaching
/// the first element of a huge range costs O(1). Otherwise it scans the covered
/// interval and filters by {@link #contains(int)}.
///
/// @see io.batchrun.core.recurrence.RecurrenceRule
public final class IntegerSetSpecifier implements Iterable<Integer> {

    private static final String PART = "(?:\\d+|(?:\\*|\\d+-\\d+)(?:/\\d+)?)";

    private static final Pattern SPEC_PATTERN = Pattern.compile("^" + PART + "(?:," + PART + ")*$");

    private static final Pattern PART_PATTERN =
            Pattern.compile("^(?:\\*|(\\d+)(?:-(\\d+))?)(?:/(\\d+))?$");

    private final String spec;
    private final int minValue;
    private final int maxValue;
    private final List<Span> spans;
    private final boolean separated;

    /// Parses a specifier over the inclusive value range `[minValue, maxValue]`.
    ///
    /// @param spec the specifier string, not null
    /// @param minValue smallest value a part may mention
    /// @param maxValue largest value a part may mention, at least `minValue`
    /// @throws BatchrunException with {@link ErrorCode#INVALID_SYNTAX} if the string does not
    ///     match the grammar, {@link ErrorCode#INVALID_RANGE} if a range starts after it stops
    ///     or `maxValue < minValue`, {@link ErrorCode#OUT_OF_RANGE} if a literal is outside
    ///     the value range
    public IntegerSetSpecifier(String spec, int minValue, int maxValue) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (!SPEC_PATTERN.matcher(spec).matches()) {
            throw new BatchrunException(ErrorCode.INVALID_SYNTAX, "Invalid spec: " + spec);
        }
        if (maxValue < minValue) {
            throw new BatchrunException(
                    ErrorCode.INVALID_RANGE, "maxValue should not be smaller than minValue");
        }
        this.spec = spec;
        this.minValue = minValue;
        this.maxValue = maxValue;

        List<Span> parsed = new ArrayList<>();
        for (String part : spec.split(",")) {
            parsed.add(parsePart(part, minValue, maxValue));
        }
        this.spans = combine(parsed);
        this.separated = limitsAreSeparate(spans);
    }

    public String spec() {
        return spec;
    }

    public int minValue() {
        return minValue;
    }

    public int maxValue() {
        return maxValue;
    }

    /// Tests membership, honouring each range's step.
    ///
    /// @param value the value to test
    /// @return `true` if any component range contains the value
    public boolean contains(int value) {
        for (Span span : spans) {
            if (span.contains(value)) {
                return true;
            }
        }
        return false;
    }

    /// Returns the number of distinct values in the set.
    ///
    /// @return value count, zero for an empty set
    public long size() {
        if (separated) {
            long total = 0;
            for (Span span : spans) {
                total += span.size();
            }
            return total;
        }
        return stream().count();
    }

    /// Returns whether the set covers every value of `[minValue, maxValue]`.
    ///
    /// @return `true` if the set is the whole value range
    public boolean isTotal() {
        Span total = new Span(minValue, maxValue + 1, 1);
        if (spec.equals("*") || (spans.size() == 1 && spans.get(0).sameValues(total))) {
            return true;
        }
        if (separated) {
            // Touching step-1 ranges were merged at construction, so a gap remains.
            return false;
        }
        for (int value = minValue; value <= maxValue; value++) {
            if (!contains(value)) {
                return false;
            }
        }
        return true;
    }

    /// Returns an equivalent specifier with merged ranges.
    ///
    /// Touching or overlapping step-1 ranges are joined, equal-step ranges in the
    /// same phase are coalesced, single values are written bare and a set covering
    /// the whole value range collapses to `*`.
    ///
    /// @return simplified specifier over the same value range, never null
    public IntegerSetSpecifier simplify() {
        String simplified =
                isTotal()
                        ? "*"
                        : spans.stream().map(Span::format).collect(Collectors.joining(","));
        return new IntegerSetSpecifier(simplified, minValue, maxValue);
    }

    /// Returns the members in ascending order as a lazy primitive stream.
    ///
    /// @return stream of members, never null
    public IntStream stream() {
        return StreamSupport.intStream(
                Spliterators.spliteratorUnknownSize(
                        intIterator(),
                        Spliterator.ORDERED
                                | Spliterator.SORTED
                                | Spliterator.DISTINCT
                                | Spliterator.NONNULL),
                false);
    }

    @Override
    public Iterator<Integer> iterator() {
        return intIterator();
    }

    /// Returns a lazy ascending iterator over the members.
    ///
    /// @return a fresh iterator, never null
    public PrimitiveIterator.OfInt intIterator() {
        if (separated) {
            List<Span> ordered = new ArrayList<>(spans);
            ordered.sort(Comparator.comparingInt(Span::start));
            return new ConcatenatingIterator(ordered);
        }
        return new FilteringIterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerSetSpecifier other)) return false;
        return minValue == other.minValue && maxValue == other.maxValue && spec.equals(other.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spec, minValue, maxValue);
    }

    /// Returns the specifier string.
    @Override
    public String toString() {
        return spec;
    }

    // --- Parsing ---

    private static Span parsePart(String part, int minValue, int maxValue) {
        Matcher m = PART_PATTERN.matcher(part);
        if (!m.matches()) {
            throw new BatchrunException(ErrorCode.INVALID_SYNTAX, "Invalid spec part: " + part);
        }
        String startText = m.group(1);
        String stopText = m.group(2);
        String stepText = m.group(3);

        long step = stepText != null ? parseNumber(stepText) : 1;
        if (step == 0) {
            throw new BatchrunException(ErrorCode.INVALID_SYNTAX, "Step must be positive: " + part);
        }
        long start;
        long stop;
        if (startText != null && stopText != null) {
            start = parseNumber(startText);
            stop = parseNumber(stopText);
            if (start > stop) {
                throw new BatchrunException(
                        ErrorCode.INVALID_RANGE, "Invalid value range in spec: " + part);
            }
        } else if (startText != null) {
            start = parseNumber(startText);
            stop = start;
        } else {
            start = (Math.floorDiv(minValue - 1L, step) + 1) * step;
            stop = maxValue;
        }
        if (start < minValue || stop > maxValue) {
            throw new BatchrunException(
                    ErrorCode.OUT_OF_RANGE,
                    "Values in spec not within value range [" + minValue + ", " + maxValue + "]: "
                            + part);
        }
        // A stepped star may start past maxValue; the span is then empty.
        int clampedStart = (int) Math.min(start, (long) maxValue + 1);
        return new Span(clampedStart, (int) stop + 1, (int) Math.min(step, Integer.MAX_VALUE));
    }

    private static long parseNumber(String digits) {
        int first = 0;
        while (first < digits.length() - 1 && digits.charAt(first) == '0') {
            first++;
        }
        String significant = digits.substring(first);
        if (significant.length() > 10) {
            return Long.MAX_VALUE;
        }
        return Long.parseLong(significant);
    }

    /// Merges ranges into their most compact form, ordered by `(step, start, stop)`.
    private static List<Span> combine(List<Span> ranges) {
        List<Span> processed = new ArrayList<>();
        for (Span span : ranges) {
            if (span.isEmpty()) continue;
            processed.add(span.size() == 1 ? new Span(span.start(), span.start() + 1, 1) : span);
        }
        processed.sort(
                Comparator.comparingInt(Span::step)
                        .thenComparingInt(Span::start)
                        .thenComparingInt(Span::stop));
        if (processed.isEmpty()) {
            return List.of();
        }

        List<Span> result = new ArrayList<>();
        Span last = processed.get(0);
        for (Span cur : processed.subList(1, processed.size())) {
            if (cur.step() == last.step() && last.reachesOrTouches(cur.start())) {
                last = new Span(last.start(), Math.max(last.stop(), cur.stop()), last.step());
            } else {
                result.add(last);
                last = cur;
            }
        }
        result.add(last);
        return List.copyOf(result);
    }

    private static boolean limitsAreSeparate(List<Span> ranges) {
        List<Span> sorted = new ArrayList<>(ranges);
        sorted.sort(
                Comparator.comparingInt(Span::start)
                        .thenComparing(Span::stop, Comparator.reverseOrder()));
        int maxStop = Integer.MIN_VALUE;
        for (Span span : sorted) {
            if (span.start() < maxStop) {
                return false;
            }
            maxStop = Math.max(maxStop, span.stop());
        }
        return true;
    }

    // --- Types ---

    /// Half-open arithmetic progression `start, start+step, ... < stop`.
    private record Span(int start, int stop, int step) {

        boolean isEmpty() {
            return start >= stop;
        }

        long size() {
            return isEmpty() ? 0 : ((long) stop - start + step - 1) / step;
        }

        boolean contains(int value) {
            return value >= start && value < stop && ((long) value - start) % step == 0;
        }

        /// True if `value` is a member or the first value past the end in this phase.
        boolean reachesOrTouches(int value) {
            return value >= start
                    && (long) value < (long) stop + step
                    && ((long) value - start) % step == 0;
        }

        int last() {
            return (int) (start + (size() - 1) * step);
        }

        boolean sameValues(Span other) {
            if (isEmpty() || other.isEmpty()) {
                return isEmpty() && other.isEmpty();
            }
            return start == other.start
                    && size() == other.size()
                    && (size() == 1 || step == other.step);
        }

        String format() {
            if ((long) start + step >= stop) {
                return Integer.toString(start);
            }
            return start + "-" + (stop - 1) + (step != 1 ? "/" + step : "");
        }
    }

    private static final class ConcatenatingIterator implements PrimitiveIterator.OfInt {
        private final Iterator<Span> remaining;
        private Span current;
        private long next;

        ConcatenatingIterator(List<Span> ordered) {
            this.remaining = ordered.iterator();
            advanceSpan();
        }

        private void advanceSpan() {
            current = null;
            while (remaining.hasNext()) {
                Span span = remaining.next();
                if (!span.isEmpty()) {
                    current = span;
                    next = span.start();
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public int nextInt() {
            if (current == null) {
                throw new NoSuchElementException();
            }
            int value = (int) next;
            if (value >= current.last()) {
                advanceSpan();
            } else {
                next += current.step();
            }
            return value;
        }
    }

    private final class FilteringIterator implements PrimitiveIterator.OfInt {
        private final long stop;
        private long cursor;

        FilteringIterator() {
            long minStart = Long.MAX_VALUE;
            long maxStop = Long.MIN_VALUE;
            for (Span span : spans) {
                minStart = Math.min(minStart, span.start());
                maxStop = Math.max(maxStop, span.stop());
            }
            this.cursor = minStart;
            this.stop = maxStop;
            skipToMember();
        }

        private void skipToMember() {
            while (cursor < stop && !contains((int) cursor)) {
                cursor++;
            }
        }

        @Override
        public boolean hasNext() {
            return cursor < stop;
        }

        @Override
        public int nextInt() {
            if (cursor >= stop) {
                throw new NoSuchElementException();
            }
            int value = (int) cursor++;
            skipToMember();
            return value;
        }
    }
}
