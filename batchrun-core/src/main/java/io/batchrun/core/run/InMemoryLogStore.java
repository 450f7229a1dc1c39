package io.batchrun.core.run;

import io.batchrun.core.compactor.CompactLog;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// In-memory {@link LogStore}.
///
/// @implNote All methods synchronize on the store, which makes
/// {@link #compact(JobRun)} atomic with respect to concurrent appends.
public final class InMemoryLogStore implements LogStore {

    private final Map<Long, List<LogEntry>> entries = new HashMap<>();
    private final Map<Long, CompactLog> compactLogs = new HashMap<>();

    @Override
    public synchronized void append(LogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.computeIfAbsent(entry.runId(), id -> new ArrayList<>()).add(entry);
    }

    @Override
    public synchronized List<LogEntry> findEntries(long runId) {
        List<LogEntry> result = new ArrayList<>(entries.getOrDefault(runId, List.of()));
        result.sort(Comparator.comparing(LogEntry::time));
        return result;
    }

    @Override
    public synchronized long countEntries(long runId) {
        return entries.getOrDefault(runId, List.of()).size();
    }

    @Override
    public synchronized Optional<CompactLog> findCompactLog(long runId) {
        return Optional.ofNullable(compactLogs.get(runId));
    }

    @Override
    public synchronized long compact(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        if (!compactLogs.containsKey(run.id())) {
            compactLogs.put(run.id(), CompactLog.forRun(run, findEntries(run.id())));
        }
        List<LogEntry> removed = entries.remove(run.id());
        return removed != null ? removed.size() : 0;
    }

    @Override
    public synchronized DeletionCounts deleteLogs(long runId) {
        List<LogEntry> removed = entries.remove(runId);
        CompactLog log = compactLogs.remove(runId);
        return new DeletionCounts(0, log != null ? 1 : 0, removed != null ? removed.size() : 0);
    }

    synchronized boolean hasEntries(long runId) {
        return !entries.getOrDefault(runId, List.of()).isEmpty();
    }

    synchronized boolean hasCompactLog(long runId) {
        return compactLogs.containsKey(runId);
    }
}
