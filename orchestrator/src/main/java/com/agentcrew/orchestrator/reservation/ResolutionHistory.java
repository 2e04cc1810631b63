package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.conflict.Resolution;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Bounded per-repository log of the most recent conflict resolutions. */
@Component
public class ResolutionHistory {

    static final int MAX_ENTRIES = 50;

    public record Entry(Instant at, String unitId, AgentRole agentType, Resolution resolution) {}

    private final Map<RepositoryRef, Deque<Entry>> entries = new ConcurrentHashMap<>();

    public void record(RepositoryRef repository, Entry entry) {
        Deque<Entry> log = entries.computeIfAbsent(repository, k -> new ArrayDeque<>());
        synchronized (log) {
            log.addLast(entry);
            while (log.size() > MAX_ENTRIES) {
                log.removeFirst();
            }
        }
    }

    /** Oldest first. */
    public List<Entry> recent(RepositoryRef repository) {
        Deque<Entry> log = entries.get(repository);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }
}
