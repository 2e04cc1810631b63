package com.agentcrew.orchestrator.executor;

import com.agentcrew.orchestrator.model.AgentRole;

/**
 * No usable answer from the code-generation engine for one stage of one unit.
 * Carries the unit and agent type so the pipeline can report which stage was lost.
 */
public class ExecutorException extends RuntimeException {

    private final String    unitId;
    private final AgentRole agentType;
    private final int       statusCode;

    /** The engine answered with a non-2xx status. */
    public ExecutorException(String unitId, AgentRole agentType, int statusCode, String body) {
        super("%s stage for unit %s rejected: HTTP %d: %s".formatted(agentType.label(), unitId, statusCode, body));
        this.unitId     = unitId;
        this.agentType  = agentType;
        this.statusCode = statusCode;
    }

    /** No answer, or an answer that could not be read. */
    public ExecutorException(String unitId, AgentRole agentType, String message, Throwable cause) {
        super("%s stage for unit %s: %s".formatted(agentType.label(), unitId, message), cause);
        this.unitId     = unitId;
        this.agentType  = agentType;
        this.statusCode = -1;
    }

    public String    unitId()    { return unitId; }
    public AgentRole agentType() { return agentType; }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() { return statusCode; }
}
