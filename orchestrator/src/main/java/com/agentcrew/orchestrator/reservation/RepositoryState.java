package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.conflict.ActiveWorkView;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.Reservation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable scheduling state of one repository.
 *
 * Every access, read or write, happens with {@link #lock} held.
 * Mutators are package-private so that only {@link ReservationManager} can change it.
 * Keying reservations by agent type makes two reservations for the same
 * (repository, agent type) pair unrepresentable.
 */
final class RepositoryState implements ActiveWorkView {

    final ReentrantLock lock = new ReentrantLock();

    private final RepositoryRef                     repository;
    private final Map<AgentRole, Reservation>       reservations = new EnumMap<>(AgentRole.class);
    private final Map<String, Reservation>          activeUnits  = new LinkedHashMap<>();
    private final Map<String, Set<String>>          fileUsage    = new HashMap<>();
    private final Map<String, Set<String>>          moduleUsage  = new HashMap<>();
    private final Map<AgentRole, Deque<QueuedTask>> queues       = new EnumMap<>(AgentRole.class);

    RepositoryState(RepositoryRef repository) {
        this.repository = repository;
    }

    // ------------------------------------------------------------------
    // ActiveWorkView
    // ------------------------------------------------------------------

    @Override public RepositoryRef repository() { return repository; }

    @Override
    public Collection<Reservation> reservations() {
        return Collections.unmodifiableCollection(activeUnits.values());
    }

    @Override
    public Optional<Reservation> reservationFor(AgentRole agentType) {
        return Optional.ofNullable(reservations.get(agentType));
    }

    @Override
    public Optional<Reservation> activeUnit(String unitId) {
        return Optional.ofNullable(activeUnits.get(unitId));
    }

    @Override
    public Set<String> claimantsOf(String file) {
        return Collections.unmodifiableSet(fileUsage.getOrDefault(file, Set.of()));
    }

    @Override
    public int queueDepth(AgentRole agentType) {
        Deque<QueuedTask> queue = queues.get(agentType);
        return queue == null ? 0 : queue.size();
    }

    // ------------------------------------------------------------------
    // Mutators (ReservationManager only)
    // ------------------------------------------------------------------

    void register(Reservation reservation) {
        reservations.put(reservation.agentType(), reservation);
        activeUnits.put(reservation.unitId(), reservation);
        index(fileUsage, reservation.context().files(), reservation.unitId());
        index(moduleUsage, reservation.context().modules(), reservation.unitId());
    }

    /** Removes the reservation and everything its unit contributed to the usage indexes. */
    Optional<Reservation> unregister(String branchName) {
        Optional<Reservation> found = reservations.values().stream()
                .filter(r -> r.branchName().equals(branchName))
                .findFirst();
        found.ifPresent(r -> {
            reservations.remove(r.agentType());
            activeUnits.remove(r.unitId());
            unindex(fileUsage, r.context().files(), r.unitId());
            unindex(moduleUsage, r.context().modules(), r.unitId());
        });
        return found;
    }

    void enqueue(QueuedTask task) {
        queues.computeIfAbsent(task.agentType(), k -> new ArrayDeque<>()).addLast(task);
    }

    /** Head of the queue: scanned before everything already waiting. */
    void enqueueFirst(QueuedTask task) {
        queues.computeIfAbsent(task.agentType(), k -> new ArrayDeque<>()).addFirst(task);
    }

    boolean dequeue(QueuedTask task) {
        Deque<QueuedTask> queue = queues.get(task.agentType());
        return queue != null && queue.removeIf(t -> t == task);
    }

    /** Snapshot of the queues in agent-type order. */
    Map<AgentRole, List<QueuedTask>> queueSnapshot() {
        Map<AgentRole, List<QueuedTask>> copy = new EnumMap<>(AgentRole.class);
        queues.forEach((role, queue) -> {
            if (!queue.isEmpty()) {
                copy.put(role, new ArrayList<>(queue));
            }
        });
        return copy;
    }

    int queuedCount() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }

    Set<String> filesInUse() {
        return new LinkedHashSet<>(fileUsage.keySet());
    }

    boolean isIdle() {
        return reservations.isEmpty() && queues.values().stream().allMatch(Deque::isEmpty);
    }

    private static void index(Map<String, Set<String>> usage, Set<String> keys, String unitId) {
        keys.forEach(k -> usage.computeIfAbsent(k, x -> new LinkedHashSet<>()).add(unitId));
    }

    private static void unindex(Map<String, Set<String>> usage, Set<String> keys, String unitId) {
        for (String key : keys) {
            Set<String> claimants = usage.get(key);
            if (claimants != null) {
                claimants.remove(unitId);
                if (claimants.isEmpty()) {
                    usage.remove(key);
                }
            }
        }
    }
}
