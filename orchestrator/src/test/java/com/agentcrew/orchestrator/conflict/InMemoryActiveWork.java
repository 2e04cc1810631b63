package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Hand-built repository state for checker and engine tests. */
class InMemoryActiveWork implements ActiveWorkView {

    private final TaskContextExtractor    extractor;
    private final List<Reservation>       active = new ArrayList<>();
    private final Map<AgentRole, Integer> queued = new EnumMap<>(AgentRole.class);

    InMemoryActiveWork(TaskContextExtractor extractor) {
        this.extractor = extractor;
    }

    Reservation activate(WorkUnit unit, AgentRole agentType, Instant at) {
        Reservation r = new Reservation(TestUnits.REPO, agentType, "agents/" + agentType.label() + "/" + unit.getId(),
                unit, extractor.extract(unit), at);
        active.add(r);
        return r;
    }

    void queue(AgentRole agentType, int depth) {
        queued.put(agentType, depth);
    }

    @Override public RepositoryRef repository() { return TestUnits.REPO; }

    @Override public Collection<Reservation> reservations() { return active; }

    @Override
    public Optional<Reservation> reservationFor(AgentRole agentType) {
        return active.stream().filter(r -> r.agentType() == agentType).findFirst();
    }

    @Override
    public Optional<Reservation> activeUnit(String unitId) {
        return active.stream().filter(r -> r.unitId().equals(unitId)).findFirst();
    }

    @Override
    public Set<String> claimantsOf(String file) {
        Set<String> ids = new LinkedHashSet<>();
        active.stream().filter(r -> r.context().files().contains(file)).forEach(r -> ids.add(r.unitId()));
        return ids;
    }

    @Override
    public int queueDepth(AgentRole agentType) {
        return queued.getOrDefault(agentType, 0);
    }
}
