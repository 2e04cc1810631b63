package com.agentcrew.orchestrator.executor.dto;

import java.util.Map;

/**
 * Request body for POST /execute on the code-generation engine.
 * Field names follow the engine's snake_case wire format.
 */
public record ExecuteStageRequest(
        String              unit_id,
        String              repository,
        String              agent_type,
        String              title,
        String              instructions,
        Map<String, String> context,
        long                timeout_sec
) {}
