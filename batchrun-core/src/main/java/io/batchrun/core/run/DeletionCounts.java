package io.batchrun.core.run;

/// Rows removed by a history deletion.
///
/// @param runs deleted job runs
/// @param compactLogs deleted compact logs
/// @param logEntries deleted fine-grained log entries
public record DeletionCounts(long runs, long compactLogs, long logEntries) {

    public static final DeletionCounts NONE = new DeletionCounts(0, 0, 0);

    public DeletionCounts plus(DeletionCounts other) {
        return new DeletionCounts(
                runs + other.runs, compactLogs + other.compactLogs, logEntries + other.logEntries);
    }
}
