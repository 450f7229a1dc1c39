package io.batchrun.core.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

/// In-memory {@link ScheduledJobRepository}.
///
/// Deletion cascades to the queue through a listener, which
/// {@link io.batchrun.core.BatchrunFactory} wires to the in-memory queue.
public final class InMemoryScheduledJobRepository implements ScheduledJobRepository {

    private final Map<String, ScheduledJob> byName = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private volatile LongConsumer deleteListener = id -> {};

    @Override
    public ScheduledJob save(ScheduledJob scheduledJob) {
        Objects.requireNonNull(scheduledJob, "scheduledJob must not be null");
        return byName.compute(
                scheduledJob.name(),
                (name, existing) ->
                        scheduledJob.withId(
                                existing != null ? existing.id() : ids.incrementAndGet()));
    }

    @Override
    public Optional<ScheduledJob> findById(long id) {
        return byName.values().stream().filter(s -> s.id() == id).findFirst();
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public List<ScheduledJob> findAll() {
        List<ScheduledJob> all = new ArrayList<>(byName.values());
        all.sort(Comparator.comparingLong(ScheduledJob::id));
        return all;
    }

    @Override
    public boolean delete(long id) {
        Optional<ScheduledJob> existing = findById(id);
        existing.ifPresent(
                s -> {
                    byName.remove(s.name());
                    deleteListener.accept(id);
                });
        return existing.isPresent();
    }

    /// Registers the action run after a scheduled job is deleted.
    public void onDelete(LongConsumer listener) {
        this.deleteListener = Objects.requireNonNull(listener, "listener must not be null");
    }
}
