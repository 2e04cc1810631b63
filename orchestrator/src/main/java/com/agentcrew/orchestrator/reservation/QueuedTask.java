package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.time.Instant;
import java.util.UUID;

/** A unit waiting in a repository's per-agent-type queue. Compared by identity. */
public final class QueuedTask {

    private final UUID              id = UUID.randomUUID();
    private final WorkUnit          unit;
    private final AgentRole         agentType;
    private final RepositoryRef     repository;
    private final Instant           queuedAt;
    private final AdmissionCallback onAdmit;

    QueuedTask(WorkUnit unit, AgentRole agentType, RepositoryRef repository, Instant queuedAt,
               AdmissionCallback onAdmit) {
        this.unit       = unit;
        this.agentType  = agentType;
        this.repository = repository;
        this.queuedAt   = queuedAt;
        this.onAdmit    = onAdmit;
    }

    public UUID          id()         { return id; }
    public WorkUnit      unit()       { return unit; }
    public AgentRole     agentType()  { return agentType; }
    public RepositoryRef repository() { return repository; }
    public Instant       queuedAt()   { return queuedAt; }

    AdmissionCallback onAdmit() { return onAdmit; }
}
