package com.agentcrew.orchestrator.conflict;

/** Which structural remedies the caller is willing to accept. */
public record ResolutionOptions(boolean allowSplit, boolean allowMerge) {

    public static final ResolutionOptions DEFAULTS = new ResolutionOptions(true, true);
}
