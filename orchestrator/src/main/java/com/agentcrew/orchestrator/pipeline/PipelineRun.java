package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.model.WorkStatus;

import java.util.concurrent.CompletableFuture;

/** Handle on a pipeline running in the worker pool; completes with the unit's final status. */
public record PipelineRun(String unitId, CancellationToken token, CompletableFuture<WorkStatus> completion) {}
