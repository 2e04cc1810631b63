package com.agentcrew.orchestrator.planning;

/** {@code from} depends on {@code to}. */
public record DependencyEdge(String from, String to) {}
