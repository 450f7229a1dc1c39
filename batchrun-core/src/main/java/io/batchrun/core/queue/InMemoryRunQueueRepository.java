package io.batchrun.core.queue;

import io.batchrun.core.schedule.ScheduledJob;
import io.batchrun.core.schedule.ScheduledJobRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// In-memory {@link RunQueueRepository}.
///
/// @implNote All methods synchronize on the repository; a claim is a
/// compare-and-set on the item's assignment.
public final class InMemoryRunQueueRepository implements RunQueueRepository {

    private static final Comparator<RunQueueItem> BY_RUN_TIME =
            Comparator.comparing(RunQueueItem::runAt).thenComparingLong(RunQueueItem::id);

    private final Map<Long, RunQueueItem> items = new LinkedHashMap<>();
    private final ScheduledJobRepository scheduledJobs;
    private long lastId;

    public InMemoryRunQueueRepository(ScheduledJobRepository scheduledJobs) {
        this.scheduledJobs =
                Objects.requireNonNull(scheduledJobs, "scheduledJobs must not be null");
    }

    @Override
    public synchronized RunQueueItem getOrCreate(long scheduledJobId, Instant runAt) {
        Objects.requireNonNull(runAt, "runAt must not be null");
        for (RunQueueItem item : items.values()) {
            if (item.scheduledJobId() == scheduledJobId && item.runAt().equals(runAt)) {
                return item;
            }
        }
        RunQueueItem created = new RunQueueItem(++lastId, scheduledJobId, runAt, null, null);
        items.put(created.id(), created);
        return created;
    }

    @Override
    public synchronized int deleteForScheduledJobExcept(
            long scheduledJobId, Collection<Long> keepIds) {
        Set<Long> keep = new HashSet<>(keepIds);
        int before = items.size();
        items.values()
                .removeIf(i -> i.scheduledJobId() == scheduledJobId && !keep.contains(i.id()));
        return before - items.size();
    }

    @Override
    public synchronized int deleteExpired(Instant limit) {
        int before = items.size();
        items.values().removeIf(i -> !i.isAssigned() && i.runAt().isBefore(limit));
        return before - items.size();
    }

    @Override
    public synchronized Optional<RunQueueItem> findFirstClaimable() {
        return items.values().stream().filter(this::isClaimable).min(BY_RUN_TIME);
    }

    @Override
    public synchronized boolean claim(long itemId, Instant now, int pid) {
        RunQueueItem item = items.get(itemId);
        if (item == null || !isClaimable(item)) {
            return false;
        }
        items.put(itemId, item.assign(now, pid));
        return true;
    }

    @Override
    public synchronized List<RunQueueItem> findAll() {
        return items.values().stream().sorted(BY_RUN_TIME).toList();
    }

    @Override
    public synchronized Optional<Instant> findNextRunAt(long scheduledJobId) {
        return items.values().stream()
                .filter(i -> i.scheduledJobId() == scheduledJobId && !i.isAssigned())
                .map(RunQueueItem::runAt)
                .min(Comparator.naturalOrder());
    }

    /// Removes all items of a deleted scheduled job.
    public synchronized void deleteForScheduledJob(long scheduledJobId) {
        items.values().removeIf(i -> i.scheduledJobId() == scheduledJobId);
    }

    private boolean isClaimable(RunQueueItem item) {
        return !item.isAssigned()
                && scheduledJobs.findById(item.scheduledJobId())
                        .map(ScheduledJob::enabled)
                        .orElse(false);
    }
}
