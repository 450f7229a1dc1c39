package io.batchrun.core.queue;

import java.time.Instant;
import java.util.Objects;

/// A materialised scheduled time of a scheduled job.
///
/// @param id storage identifier
/// @param scheduledJobId owning scheduled job
/// @param runAt when the job should run, not null
/// @param assignedAt when a scheduler claimed the item, null while unclaimed
/// @param assigneePid process id of the claiming scheduler, null while unclaimed
public record RunQueueItem(
        long id, long scheduledJobId, Instant runAt, Instant assignedAt, Integer assigneePid) {

    public RunQueueItem {
        Objects.requireNonNull(runAt, "runAt must not be null");
    }

    public boolean isAssigned() {
        return assignedAt != null;
    }

    public RunQueueItem assign(Instant at, int pid) {
        return new RunQueueItem(id, scheduledJobId, runAt, at, pid);
    }
}
