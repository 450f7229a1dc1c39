package io.batchrun.core.execution;

import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import io.batchrun.core.run.LogStore;
import io.batchrun.core.util.Retry;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reads one output stream of a child process to EOF and stores it as log entries.
///
/// A failed write is retried with back-off and then dropped; the stream keeps being
/// drained so the child never blocks on a full pipe.
///
/// @implNote One instance per stream, run on its own thread.
public final class OutputCollector implements Runnable {

    private static final Logger logger = Logger.getLogger(OutputCollector.class.getName());

    private final long runId;
    private final LogEntryKind kind;
    private final InputStream stream;
    private final LogStore logStore;
    private final Clock clock;
    private final Retry retry;
    private final int chunkSize;
    private final LineSplitter splitter;
    private long droppedEntries;

    public OutputCollector(
            long runId,
            LogEntryKind kind,
            InputStream stream,
            LogStore logStore,
            Clock clock,
            Retry retry,
            int chunkSize) {
        this.runId = runId;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
        this.splitter = new LineSplitter(runId, kind);
    }

    @Override
    public void run() {
        byte[] buffer = new byte[chunkSize];
        try (InputStream in = stream) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (read > 0) {
                    store(splitter.accept(buffer, read, clock.instant()));
                }
            }
            store(splitter.finish(clock.instant()));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Reading " + kind + " of run " + runId + " failed", e);
        }
        if (droppedEntries > 0) {
            logger.warning(
                    "Dropped " + droppedEntries + " " + kind + " entries of run " + runId);
        }
    }

    private void store(List<LogEntry> entries) {
        for (LogEntry entry : entries) {
            try {
                retry.run("store log entry of run " + runId, () -> logStore.append(entry));
            } catch (RuntimeException e) {
                droppedEntries++;
                logger.log(
                        Level.WARNING,
                        "Dropping " + kind + " entry " + entry.lineNumber() + "("
                                + entry.number() + ") of run " + runId,
                        e);
            }
        }
    }

    /// Returns how many entries could not be stored.
    public long getDroppedEntries() {
        return droppedEntries;
    }
}
