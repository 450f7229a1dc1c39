package io.batchrun.core.compactor;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import io.batchrun.core.run.LogEntryKind;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Per-entry metadata of a compact log, version 1.
///
/// Entry `i` starts at the sum of `lengths[0..i)` code points of the content, has
/// kind `kinds[i]` and time `start + (deltas[0] + ... + deltas[i]) * precisionMicros`.
///
/// ### Contracts
/// - **Invariant**: `version == 1`, `precisionMicros > 0`
/// - **Invariant**: the three lists have equal length, which is zero iff `start` is null
/// - **Invariant**: `start` has microsecond resolution; finer input is rounded to the
///   nearest microsecond
/// - **Invariant**: every kind is a known {@link LogEntryKind} code, every length is `>= 0`
///
/// @param version format version, always {@link #VERSION}
/// @param precisionMicros microseconds per time tick
/// @param start time of the first entry, null when there are no entries
/// @param deltas time difference of each entry to the previous one, in ticks
/// @param kinds stream code of each entry
/// @param lengths text length of each entry, in code points
public record EntryData(
        int version,
        long precisionMicros,
        Instant start,
        List<Long> deltas,
        List<Integer> kinds,
        List<Integer> lengths) {

    public static final int VERSION = 1;

    /// Default time precision, one microsecond.
    public static final long DEFAULT_PRECISION_MICROS = 1;

    public EntryData {
        if (version != VERSION) {
            throw invalid("Unsupported version: " + version);
        }
        if (precisionMicros <= 0) {
            throw invalid("Invalid precision: " + precisionMicros);
        }
        Objects.requireNonNull(deltas, "deltas must not be null");
        Objects.requireNonNull(kinds, "kinds must not be null");
        Objects.requireNonNull(lengths, "lengths must not be null");
        if (deltas.size() != kinds.size() || kinds.size() != lengths.size()) {
            throw invalid(
                    "Data length mismatch: "
                            + deltas.size() + "/" + kinds.size() + "/" + lengths.size());
        }
        if ((start == null) != deltas.isEmpty()) {
            throw invalid("Start timestamp must be present exactly when there are entries");
        }
        for (Integer kind : kinds) {
            LogEntryKind.fromCode(kind);
        }
        for (Integer length : lengths) {
            if (length < 0) {
                throw invalid("Negative entry length: " + length);
            }
        }
        start = start == null ? null : roundToMicros(start);
        deltas = List.copyOf(deltas);
        kinds = List.copyOf(kinds);
        lengths = List.copyOf(lengths);
    }

    /// Metadata of one entry.
    public record Item(Instant time, LogEntryKind kind, int length) {}

    /// Encodes entry metadata.
    ///
    /// Each time is rounded to the nearest tick relative to the first time, and the
    /// stored delta is that tick count minus the ticks already stored, so rounding
    /// errors never accumulate.
    ///
    /// @param items metadata in log order, not null
    /// @param precisionMicros microseconds per tick, positive
    /// @return the encoded data, never null
    public static EntryData encode(List<Item> items, long precisionMicros) {
        Objects.requireNonNull(items, "items must not be null");
        if (precisionMicros <= 0) {
            throw invalid("Invalid precision: " + precisionMicros);
        }
        long tickNanos = precisionMicros * 1000;
        Instant start = items.isEmpty() ? null : roundToMicros(items.get(0).time());
        List<Long> deltas = new ArrayList<>(items.size());
        List<Integer> kinds = new ArrayList<>(items.size());
        List<Integer> lengths = new ArrayList<>(items.size());
        long ticksSoFar = 0;
        for (Item item : items) {
            long elapsedNanos = Duration.between(start, item.time()).toNanos();
            long ticks = Math.floorDiv(elapsedNanos + tickNanos / 2, tickNanos);
            deltas.add(ticks - ticksSoFar);
            ticksSoFar = ticks;
            kinds.add(item.kind().code());
            lengths.add(item.length());
        }
        return new EntryData(VERSION, precisionMicros, start, deltas, kinds, lengths);
    }

    /// Decodes the entry metadata.
    ///
    /// @return one item per entry in log order, never null
    public List<Item> items() {
        List<Item> items = new ArrayList<>(deltas.size());
        long ticks = 0;
        for (int i = 0; i < deltas.size(); i++) {
            ticks += deltas.get(i);
            Instant time = start.plusNanos(Math.multiplyExact(ticks, precisionMicros * 1000));
            items.add(new Item(time, LogEntryKind.fromCode(kinds.get(i)), lengths.get(i)));
        }
        return items;
    }

    public int size() {
        return deltas.size();
    }

    private static Instant roundToMicros(Instant time) {
        int subMicros = time.getNano() % 1000;
        Instant truncated = time.truncatedTo(ChronoUnit.MICROS);
        return subMicros >= 500 ? truncated.plusNanos(1000) : truncated;
    }

    private static BatchrunException invalid(String message) {
        return new BatchrunException(ErrorCode.INVALID_METADATA, message);
    }
}
