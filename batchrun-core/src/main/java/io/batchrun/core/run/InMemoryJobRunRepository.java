package io.batchrun.core.run;

import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.command.RetentionPolicy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory {@link JobRunRepository} backed by an {@link InMemoryLogStore}.
///
/// Retention policies are looked up from the catalog at query time, so a job whose
/// policy changes is cleaned by its current policy.
public final class InMemoryJobRunRepository implements JobRunRepository {

    private final Map<Long, JobRun> runs = new ConcurrentSkipListMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final JobCatalog catalog;
    private final InMemoryLogStore logStore;

    public InMemoryJobRunRepository(JobCatalog catalog, InMemoryLogStore logStore) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
    }

    @Override
    public JobRun create(Job job, Instant startedAt) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        long id = ids.incrementAndGet();
        JobRun run = new JobRun(id, job.id(), job.name(), null, startedAt, null, null);
        runs.put(id, run);
        return run;
    }

    @Override
    public Optional<JobRun> findById(long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public void updatePid(long runId, int pid) {
        runs.computeIfPresent(runId, (id, run) -> run.withPid(pid));
    }

    @Override
    public void markStopped(long runId, Instant stoppedAt, int exitCode) {
        runs.computeIfPresent(runId, (id, run) -> run.withResult(stoppedAt, exitCode));
    }

    @Override
    public List<JobRun> findRecent(int limit, OptionalInt exitCode) {
        return runs.values().stream()
                .filter(
                        r ->
                                exitCode.isEmpty()
                                        || (r.exitCode() != null
                                                && r.exitCode() == exitCode.getAsInt()))
                .sorted(
                        Comparator.comparing(JobRun::startedAt)
                                .thenComparingLong(JobRun::id)
                                .reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<Instant> latestStartedAt() {
        return runs.values().stream().map(JobRun::startedAt).max(Comparator.naturalOrder());
    }

    @Override
    public long count() {
        return runs.size();
    }

    @Override
    public long deleteStartedBefore(Instant cutoff) {
        List<Long> old =
                runs.values().stream()
                        .filter(r -> r.startedAt().isBefore(cutoff))
                        .map(JobRun::id)
                        .toList();
        return deleteWithLogs(old).runs();
    }

    @Override
    public List<RunRetention> findRetentionCandidates(Instant now) {
        List<RunRetention> candidates = new ArrayList<>();
        for (JobRun run : runs.values()) {
            RetentionPolicy policy =
                    catalog.findJob(run.jobId())
                            .map(Job::retentionPolicy)
                            .orElse(RetentionPolicy.DEFAULT);
            if (!run.startedAt().plus(policy.compactDelay()).isAfter(now)) {
                candidates.add(
                        new RunRetention(
                                run.id(),
                                run.startedAt(),
                                policy,
                                logStore.hasEntries(run.id()),
                                logStore.hasCompactLog(run.id())));
            }
        }
        return candidates;
    }

    @Override
    public DeletionCounts deleteWithLogs(Collection<Long> runIds) {
        DeletionCounts total = DeletionCounts.NONE;
        for (Long runId : runIds) {
            DeletionCounts logs = logStore.deleteLogs(runId);
            long deleted = runs.remove(runId) != null ? 1 : 0;
            total = total.plus(new DeletionCounts(deleted, logs.compactLogs(), logs.logEntries()));
        }
        return total;
    }
}
