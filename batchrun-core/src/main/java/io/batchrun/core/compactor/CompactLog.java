package io.batchrun.core.compactor;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The log of a run collapsed into one text and a compact metadata side channel.
///
/// `content` is the concatenation of all entry texts in log order; {@link EntryData}
/// holds the time, kind and length of each entry. {@link #expand(long)} restores the
/// entries, exact on kind and text and within the precision on time.
///
/// ### Contracts
/// - **Invariant**: the entry lengths sum to the code point count of `content`
/// - **Invariant**: `entryCount == entryData.size()`
///
/// @param content concatenated entry texts, not null
/// @param entryData per-entry metadata, not null
/// @param firstTimestamp time of the first entry, or the run start when there are none
/// @param lastTimestamp time of the last entry, or the run stop when there are none
/// @param entryCount number of entries
/// @param errorCount number of {@link LogEntryKind#STDERR} entries
public record CompactLog(
        String content,
        EntryData entryData,
        Instant firstTimestamp,
        Instant lastTimestamp,
        int entryCount,
        int errorCount) {

    public CompactLog {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(entryData, "entryData must not be null");
        Objects.requireNonNull(firstTimestamp, "firstTimestamp must not be null");
        Objects.requireNonNull(lastTimestamp, "lastTimestamp must not be null");
        long total = 0;
        for (Integer length : entryData.lengths()) {
            total += length;
        }
        if (total != content.codePointCount(0, content.length())) {
            throw new BatchrunException(
                    ErrorCode.INVALID_METADATA,
                    "Entry lengths sum to " + total + " but content has "
                            + content.codePointCount(0, content.length()) + " characters");
        }
        if (entryCount != entryData.size()) {
            throw new BatchrunException(
                    ErrorCode.INVALID_METADATA,
                    "Entry count " + entryCount + " does not match metadata size "
                            + entryData.size());
        }
    }

    /// Compacts the entries of a run.
    ///
    /// When there are no entries the timestamps fall back to the run's start and stop
    /// times.
    ///
    /// @param run the owning run, not null
    /// @param entries the run's entries in log order, not null
    /// @return the compact log, never null
    public static CompactLog forRun(JobRun run, List<LogEntry> entries) {
        Objects.requireNonNull(run, "run must not be null");
        return fromEntries(
                entries,
                EntryData.DEFAULT_PRECISION_MICROS,
                run.startedAt(),
                run.stoppedAt() != null ? run.stoppedAt() : run.startedAt());
    }

    /// Compacts entries with the given time precision.
    ///
    /// @param entries entries in log order, not empty
    /// @param precisionMicros microseconds per time tick, positive
    /// @return the compact log, never null
    public static CompactLog fromEntries(List<LogEntry> entries, long precisionMicros) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("entries must not be empty");
        }
        return fromEntries(entries, precisionMicros, null, null);
    }

    private static CompactLog fromEntries(
            List<LogEntry> entries, long precisionMicros, Instant emptyFirst, Instant emptyLast) {
        Objects.requireNonNull(entries, "entries must not be null");
        StringBuilder content = new StringBuilder();
        List<EntryData.Item> items = new ArrayList<>(entries.size());
        int errors = 0;
        for (LogEntry entry : entries) {
            content.append(entry.text());
            items.add(
                    new EntryData.Item(
                            entry.time(),
                            entry.kind(),
                            entry.text().codePointCount(0, entry.text().length())));
            if (entry.kind() == LogEntryKind.STDERR) {
                errors++;
            }
        }
        Instant first = entries.isEmpty() ? emptyFirst : entries.get(0).time();
        Instant last = entries.isEmpty() ? emptyLast : entries.get(entries.size() - 1).time();
        return new CompactLog(
                content.toString(),
                EntryData.encode(items, precisionMicros),
                first,
                last,
                entries.size(),
                errors);
    }

    /// Restores the entries of this log.
    ///
    /// Line numbers and numbers within a line are recomputed per stream with the
    /// same rule the output collector uses.
    ///
    /// @param runId the run the entries belong to
    /// @return the entries in log order, never null
    public List<LogEntry> expand(long runId) {
        List<LogEntry> entries = new ArrayList<>(entryCount);
        Map<LogEntryKind, int[]> positions = new EnumMap<>(LogEntryKind.class);
        int offset = 0;
        for (EntryData.Item item : entryData.items()) {
            int end = content.offsetByCodePoints(offset, item.length());
            String text = content.substring(offset, end);
            offset = end;

            int[] position = positions.computeIfAbsent(item.kind(), k -> new int[] {1, 1});
            entries.add(
                    new LogEntry(runId, item.kind(), position[0], position[1], item.time(), text));
            if (LogEntry.endsWithLineTerminator(text)) {
                position[0]++;
                position[1] = 1;
            } else {
                position[1]++;
            }
        }
        return entries;
    }
}
