package io.batchrun.core.cleaning;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/// Runs partitioned by clean action at a clean time.
///
/// ### Contracts
/// - **Invariant**: every run appears under at most one action
///
/// @param cleanTime the time the delays were evaluated against, not null
/// @param runIds run ids per action, every action present, never null
public record CleaningPlan(Instant cleanTime, Map<CleanAction, SortedSet<Long>> runIds) {

    public CleaningPlan {
        Objects.requireNonNull(cleanTime, "cleanTime must not be null");
        Map<CleanAction, SortedSet<Long>> copy = new EnumMap<>(CleanAction.class);
        for (CleanAction action : CleanAction.values()) {
            copy.put(
                    action,
                    Collections.unmodifiableSortedSet(
                            new TreeSet<>(runIds.getOrDefault(action, new TreeSet<>()))));
        }
        runIds = Collections.unmodifiableMap(copy);
    }

    public SortedSet<Long> get(CleanAction action) {
        return runIds.get(action);
    }

    public boolean isEmpty() {
        return runIds.values().stream().allMatch(SortedSet::isEmpty);
    }
}
