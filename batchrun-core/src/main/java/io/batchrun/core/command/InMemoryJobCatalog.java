package io.batchrun.core.command;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory {@link JobCatalog}.
///
/// Seeded with {@link RetentionPolicy#DEFAULT}.
///
/// @implNote Thread-safe via {@link ConcurrentHashMap}; identifiers come from
/// per-catalog counters.
public final class InMemoryJobCatalog implements JobCatalog {

    private final Map<String, JobCommand> commands = new ConcurrentHashMap<>();
    private final Map<String, RetentionPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong commandIds = new AtomicLong();
    private final AtomicLong jobIds = new AtomicLong();

    public InMemoryJobCatalog() {
        policies.put(RetentionPolicy.DEFAULT_IDENTIFIER, RetentionPolicy.DEFAULT);
    }

    @Override
    public JobCommand saveCommand(JobCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        return commands.compute(
                command.name(),
                (name, existing) ->
                        command.withId(
                                existing != null ? existing.id() : commandIds.incrementAndGet()));
    }

    @Override
    public Optional<JobCommand> findCommand(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    @Override
    public void saveRetentionPolicy(RetentionPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        policies.put(policy.identifier(), policy);
    }

    @Override
    public Optional<RetentionPolicy> findRetentionPolicy(String identifier) {
        return Optional.ofNullable(policies.get(identifier));
    }

    @Override
    public Job saveJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (!commands.containsKey(job.command().name())) {
            throw new IllegalStateException("Command is not stored: " + job.command().name());
        }
        if (!policies.containsKey(job.retentionPolicy().identifier())) {
            throw new IllegalStateException(
                    "Retention policy is not stored: " + job.retentionPolicy().identifier());
        }
        return jobs.compute(
                job.name(),
                (name, existing) ->
                        job.withId(existing != null ? existing.id() : jobIds.incrementAndGet()));
    }

    @Override
    public Optional<Job> findJob(long jobId) {
        return jobs.values().stream().filter(j -> j.id() == jobId).findFirst();
    }

    @Override
    public Optional<Job> findJobByName(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    @Override
    public List<Job> findAllJobs() {
        List<Job> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparingLong(Job::id));
        return all;
    }
}
