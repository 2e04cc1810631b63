package com.agentcrew.orchestrator.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of remedies the resolution engine can choose. */
public enum ResolutionStrategy {
    NO_CONFLICT,

    // file_overlap
    SEQUENCE_AFTER_CONFLICTS,
    SPLIT_TASK,
    PREEMPT_LOWER_PRIORITY,
    INTELLIGENT_QUEUE,

    // module_overlap
    LAYER_SEPARATION,
    MERGE_RELATED_TASKS,
    SEQUENTIAL_WITH_INTERFACE,

    // dependency_conflict
    RESOLVE_CIRCULAR_DEPENDENCIES,
    WAIT_FOR_DEPENDENCIES,
    PARALLEL_EXECUTION,

    // agent_busy
    REASSIGN_TO_AVAILABLE_AGENT,
    SPLIT_FOR_AGENT_CAPACITY,
    WORKLOAD_BALANCED_QUEUE,

    // conceptual_conflict
    MERGE_CONCEPTUAL_TASKS,
    COORDINATE_RELATED_FEATURES,

    MANUAL_INTERVENTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
