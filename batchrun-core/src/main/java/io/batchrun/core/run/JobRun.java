package io.batchrun.core.run;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/// One execution of a job.
///
/// Lifecycle is created (only `startedAt`), running (`pid` set) and finished
/// (`stoppedAt` and `exitCode` set). Fields are never cleared once written.
///
/// @param id storage identifier, positive
/// @param jobId the executed job
/// @param jobName name of the executed job, for display, not null
/// @param pid process id of the child, null until spawned
/// @param startedAt creation time, not null
/// @param stoppedAt when the child was reaped, null while running
/// @param exitCode exit status of the child, null while running, `-1` if it could not start
public record JobRun(
        long id,
        long jobId,
        String jobName,
        Integer pid,
        Instant startedAt,
        Instant stoppedAt,
        Integer exitCode) {

    /// Exit code recorded when the command could not be spawned.
    public static final int SPAWN_FAILED = -1;

    private static final DateTimeFormatter DISPLAY_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm").withZone(ZoneOffset.UTC);

    public JobRun {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    public boolean isFinished() {
        return stoppedAt != null;
    }

    public JobRun withPid(int newPid) {
        return new JobRun(id, jobId, jobName, newPid, startedAt, stoppedAt, exitCode);
    }

    public JobRun withResult(Instant stopTime, int code) {
        return new JobRun(id, jobId, jobName, pid, startedAt, stopTime, code);
    }

    /// Renders as `job [pid] (start)`.
    @Override
    public String toString() {
        return jobName + " [" + pid + "] (" + DISPLAY_TIME.format(startedAt) + ")";
    }
}
