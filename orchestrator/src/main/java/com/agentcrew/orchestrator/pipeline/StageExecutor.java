package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.Map;

/**
 * The external code-generation engine. Invoked once per pipeline stage.
 */
public interface StageExecutor {

    /**
     * @param context outputs of the stages that already ran, keyed by agent label
     * @return the outcome; a reported failure is returned, transport failures are thrown
     */
    StageResult execute(WorkUnit unit, AgentRole agentType, String instructions, Map<String, String> context);
}
