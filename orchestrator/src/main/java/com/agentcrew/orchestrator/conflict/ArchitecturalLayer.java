package com.agentcrew.orchestrator.conflict;

import java.util.List;

/** Coarse layer of a module a unit of work is likely to touch. */
public enum ArchitecturalLayer {
    PRESENTATION(List.of("ui", "component", "view", "page", "frontend")),
    API(List.of("api", "endpoint", "route", "controller")),
    DOMAIN(List.of("service", "logic", "business", "workflow")),
    DATA(List.of("database", "model", "schema", "migration", "repository"));

    private final List<String> keywords;

    ArchitecturalLayer(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() { return keywords; }
}
