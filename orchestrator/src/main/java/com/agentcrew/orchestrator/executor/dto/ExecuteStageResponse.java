package com.agentcrew.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response from POST /execute. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteStageResponse(
        boolean      success,
        String       output,
        List<String> files_changed,
        String       error
) {}
