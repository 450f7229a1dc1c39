package io.batchrun.core.cleaning;

/// History clean-up actions, in execution order.
public enum CleanAction {
    DELETE_RUN,
    DELETE_LOGS,
    COMPACT_LOGS
}
