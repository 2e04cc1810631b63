package com.agentcrew.orchestrator.pipeline;

import java.util.List;

/** What the code-generation engine reports for one stage. */
public record StageResult(boolean success, String output, List<String> filesChanged, String error) {

    public StageResult {
        filesChanged = filesChanged == null ? List.of() : List.copyOf(filesChanged);
    }

    public static StageResult success(String output, List<String> filesChanged) {
        return new StageResult(true, output, filesChanged, null);
    }

    public static StageResult failure(String error) {
        return new StageResult(false, null, List.of(), error);
    }
}
