package com.agentcrew.orchestrator.pipeline;

/**
 * A pipeline stage could not complete: the engine reported failure or was
 * unreachable, the git host rejected the branch or pull request, or the
 * stage's branch reservation could not be obtained.
 */
public class StageExecutionException extends RuntimeException {

    public StageExecutionException(String message) {
        super(message);
    }

    public StageExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
