package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.conflict.CompatibilityChecker;
import com.agentcrew.orchestrator.conflict.CompatibilityResult;
import com.agentcrew.orchestrator.conflict.ConflictResolutionEngine;
import com.agentcrew.orchestrator.conflict.Resolution;
import com.agentcrew.orchestrator.conflict.ResolutionOptions;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.TaskContext;
import com.agentcrew.orchestrator.model.WorkUnit;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Owns every branch reservation, queue and usage index.
 *
 * Each repository has its own lock. Every operation that reads or changes
 * a repository's state, and in particular the check-then-reserve sequence,
 * runs with that lock held, so two callers can never both see "compatible"
 * and both reserve. Repositories never share a lock.
 *
 * Queue admission admits at most the first compatible entry per agent-type
 * queue per scan, and a release triggers exactly one scan. Admissions are
 * decided under the lock; the waiters' callbacks run after it is released.
 */
@Component
public class ReservationManager {

    private static final Logger log = LoggerFactory.getLogger(ReservationManager.class);

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final int     MAX_SLUG  = 30;

    private final SchedulerState state = new SchedulerState();

    private final CompatibilityChecker     checker;
    private final ConflictResolutionEngine engine;
    private final ResolutionHistory        history;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;

    public ReservationManager(CompatibilityChecker checker,
                              ConflictResolutionEngine engine,
                              ResolutionHistory history,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.checker       = checker;
        this.engine        = engine;
        this.history       = history;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;

        Gauge.builder("agentcrew.reservations.queued", this, ReservationManager::queuedTotal)
                .description("Units waiting for a branch, all repositories")
                .register(meterRegistry);
    }

    /** An admission decided under a repository lock, delivered after unlocking. */
    private record Admission(RepositoryState repoState, QueuedTask task, Reservation reservation) {}

    // ------------------------------------------------------------------
    // Reserve / release
    // ------------------------------------------------------------------

    /**
     * Re-check compatibility and reserve in one critical section.
     *
     * @throws TaskConflictException if the unit conflicts with active work
     */
    public Reservation reserveBranch(WorkUnit unit, AgentRole agentType, RepositoryRef repo) {
        RepositoryState repoState = state.stateFor(repo);
        repoState.lock.lock();
        try {
            CompatibilityResult result = checker.check(unit, agentType, repoState);
            if (!result.compatible()) {
                meterRegistry.counter("agentcrew.reservations.attempts",
                        "outcome", "conflict", "category", result.reason().wireName()).increment();
                log.info("Reservation of {} for unit {} on {} refused: {} with {}",
                        agentType.label(), unit.getId(), repo, result.reason().wireName(),
                        result.conflictingUnitIds());
                throw new TaskConflictException(result);
            }
            return register(repoState, unit, agentType, result.context());
        } finally {
            repoState.lock.unlock();
        }
    }

    /**
     * Release a reservation and run one queue-admission scan for its repository.
     * Releasing an unknown or already released branch only logs a warning.
     *
     * @return whether a reservation was released
     */
    public boolean releaseBranch(String branchName) {
        return release(branchName, "completed");
    }

    /** Operator override; same as {@link #releaseBranch} but logged with a reason. */
    public boolean forceReleaseBranch(String branchName, String reason) {
        log.warn("Force releasing branch {}: {}", branchName, reason);
        return release(branchName, "forced");
    }

    private boolean release(String branchName, String reason) {
        Optional<RepositoryRef> repo = state.repositoryOf(branchName);
        if (repo.isEmpty()) {
            log.warn("Release of unknown branch {} ignored", branchName);
            return false;
        }
        RepositoryState repoState = state.stateFor(repo.get());
        List<Admission> admissions;
        repoState.lock.lock();
        try {
            if (!unregister(repoState, branchName, reason)) {
                log.warn("Branch {} was already released", branchName);
                return false;
            }
            admissions = admitNext(repoState);
        } finally {
            repoState.lock.unlock();
        }
        deliver(admissions);
        return true;
    }

    // ------------------------------------------------------------------
    // Queueing
    // ------------------------------------------------------------------

    public QueuedTask queueAgentTask(WorkUnit unit, AgentRole agentType, RepositoryRef repo,
                                     AdmissionCallback onAdmit) {
        return enqueue(unit, agentType, repo, onAdmit, false);
    }

    /**
     * Queue ahead of everything already waiting for the agent type. Used when
     * the unit outranks the work it conflicts with.
     */
    public QueuedTask queueAgentTaskFirst(WorkUnit unit, AgentRole agentType, RepositoryRef repo,
                                          AdmissionCallback onAdmit) {
        return enqueue(unit, agentType, repo, onAdmit, true);
    }

    private QueuedTask enqueue(WorkUnit unit, AgentRole agentType, RepositoryRef repo,
                               AdmissionCallback onAdmit, boolean first) {
        RepositoryState repoState = state.stateFor(repo);
        repoState.lock.lock();
        try {
            QueuedTask task = new QueuedTask(unit, agentType, repo, clock.instant(), onAdmit);
            if (first) {
                repoState.enqueueFirst(task);
            } else {
                repoState.enqueue(task);
            }
            log.info("Queued unit {} for {} on {} (position {})",
                    unit.getId(), agentType.label(), repo, first ? 1 : repoState.queueDepth(agentType));
            return task;
        } finally {
            repoState.lock.unlock();
        }
    }

    /** @return false if the entry was no longer queued (already admitted or removed) */
    public boolean dequeue(QueuedTask task) {
        RepositoryState repoState = state.stateFor(task.repository());
        repoState.lock.lock();
        try {
            return repoState.dequeue(task);
        } finally {
            repoState.lock.unlock();
        }
    }

    /**
     * Admit at most one entry per agent-type queue: the first one that is
     * compatible right now. Earlier, still blocked entries keep their place.
     *
     * @return ids of the admitted units
     */
    public List<String> processQueue(RepositoryRef repo) {
        Optional<RepositoryState> existing = state.existing(repo);
        if (existing.isEmpty()) {
            return List.of();
        }
        RepositoryState repoState = existing.get();
        List<Admission> admissions;
        repoState.lock.lock();
        try {
            admissions = admitNext(repoState);
        } finally {
            repoState.lock.unlock();
        }
        return deliver(admissions);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Force-release every reservation older than the threshold, on every repository.
     *
     * @return number of reservations released
     */
    public int emergencyCleanup(long olderThanMinutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(olderThanMinutes));
        int released = 0;
        for (RepositoryState repoState : state.all()) {
            List<Admission> admissions = List.of();
            repoState.lock.lock();
            try {
                List<Reservation> stale = repoState.reservations().stream()
                        .filter(r -> r.createdAt().isBefore(cutoff))
                        .toList();
                for (Reservation r : stale) {
                    log.warn("Releasing stale reservation {} of unit {} ({} min old)",
                            r.branchName(), r.unitId(), r.age(clock.instant()).toMinutes());
                    if (unregister(repoState, r.branchName(), "stale")) {
                        released++;
                    }
                }
                if (!stale.isEmpty()) {
                    admissions = admitNext(repoState);
                }
            } finally {
                repoState.lock.unlock();
            }
            deliver(admissions);
        }
        if (released > 0) {
            log.warn("Emergency cleanup released {} reservations older than {} minutes", released, olderThanMinutes);
        }
        return released;
    }

    // ------------------------------------------------------------------
    // Conflict handling
    // ------------------------------------------------------------------

    public CompatibilityResult checkCompatibility(WorkUnit unit, AgentRole agentType, RepositoryRef repo) {
        RepositoryState repoState = state.stateFor(repo);
        repoState.lock.lock();
        try {
            return checker.check(unit, agentType, repoState);
        } finally {
            repoState.lock.unlock();
        }
    }

    /**
     * Check the unit against live state and, if it conflicts, resolve it.
     * The outcome is recorded in the repository's resolution history.
     */
    public Resolution resolveConflict(WorkUnit unit, AgentRole agentType, RepositoryRef repo,
                                      ResolutionOptions options) {
        RepositoryState repoState = state.stateFor(repo);
        repoState.lock.lock();
        try {
            CompatibilityResult result = checker.check(unit, agentType, repoState);
            if (result.compatible()) {
                return Resolution.noConflict();
            }
            Resolution resolution = engine.resolve(unit, agentType, result.reason(), result.conflicts(),
                    repoState, options);
            history.record(repo, new ResolutionHistory.Entry(clock.instant(), unit.getId(), agentType, resolution));
            return resolution;
        } finally {
            repoState.lock.unlock();
        }
    }

    public List<ResolutionHistory.Entry> resolutionHistory(RepositoryRef repo) {
        return history.recent(repo);
    }

    // ------------------------------------------------------------------
    // Monitoring
    // ------------------------------------------------------------------

    public RepositoryStatus getRepositoryStatus(RepositoryRef repo) {
        Optional<RepositoryState> existing = state.existing(repo);
        if (existing.isEmpty()) {
            return new RepositoryStatus(repo.fullName(), List.of(), 0, Map.of(), Set.of());
        }
        RepositoryState repoState = existing.get();
        repoState.lock.lock();
        try {
            return snapshot(repoState);
        } finally {
            repoState.lock.unlock();
        }
    }

    /** Status of every repository that has reservations or queued work. */
    public List<RepositoryStatus> getAllRepositoriesStatus() {
        List<RepositoryStatus> out = new ArrayList<>();
        for (RepositoryState repoState : state.all()) {
            repoState.lock.lock();
            try {
                if (!repoState.isIdle()) {
                    out.add(snapshot(repoState));
                }
            } finally {
                repoState.lock.unlock();
            }
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Internals (caller holds the repository lock)
    // ------------------------------------------------------------------

    private Reservation register(RepositoryState repoState, WorkUnit unit, AgentRole agentType, TaskContext context) {
        if (repoState.activeUnit(unit.getId()).isPresent()) {
            throw new IllegalStateException(
                    "Unit " + unit.getId() + " already holds a reservation on " + repoState.repository());
        }
        Instant now = clock.instant();
        Reservation reservation = new Reservation(repoState.repository(), agentType,
                branchName(unit, agentType, now), unit, context, now);
        repoState.register(reservation);
        state.indexBranch(reservation.branchName(), repoState.repository());
        meterRegistry.counter("agentcrew.reservations.attempts",
                "outcome", "reserved", "category", "none").increment();
        log.info("Reserved {} on {} for unit {} ({} files, {} modules)",
                reservation.branchName(), repoState.repository(), unit.getId(),
                context.files().size(), context.modules().size());
        return reservation;
    }

    private boolean unregister(RepositoryState repoState, String branchName, String reason) {
        Optional<Reservation> removed = repoState.unregister(branchName);
        removed.ifPresent(r -> {
            state.forgetBranch(branchName);
            meterRegistry.counter("agentcrew.reservations.released", "reason", reason).increment();
            log.info("Released {} on {} (unit {}, {})", branchName, repoState.repository(), r.unitId(), reason);
        });
        return removed.isPresent();
    }

    private List<Admission> admitNext(RepositoryState repoState) {
        List<Admission> admissions = new ArrayList<>();
        for (List<QueuedTask> queue : repoState.queueSnapshot().values()) {
            for (QueuedTask task : queue) {
                if (repoState.activeUnit(task.unit().getId()).isPresent()) {
                    continue;   // admitted once its current branch is released
                }
                CompatibilityResult result = checker.check(task.unit(), task.agentType(), repoState);
                if (!result.compatible()) {
                    continue;
                }
                repoState.dequeue(task);
                admissions.add(new Admission(repoState, task,
                        register(repoState, task.unit(), task.agentType(), result.context())));
                break;
            }
        }
        return admissions;
    }

    /** Tell the admitted waiters. Caller must not hold any repository lock. */
    private List<String> deliver(List<Admission> admissions) {
        List<String> admitted = new ArrayList<>();
        for (Admission admission : admissions) {
            QueuedTask task = admission.task();
            try {
                task.onAdmit().admitted(admission.reservation());
                admitted.add(task.unit().getId());
            } catch (RuntimeException e) {
                log.warn("Admission callback for unit {} failed, rolling back {}: {}",
                        task.unit().getId(), admission.reservation().branchName(), e.getMessage());
                rollback(admission);
            }
        }
        return admitted;
    }

    private void rollback(Admission admission) {
        RepositoryState repoState = admission.repoState();
        List<Admission> next = List.of();
        repoState.lock.lock();
        try {
            if (unregister(repoState, admission.reservation().branchName(), "rollback")) {
                next = admitNext(repoState);
            }
        } finally {
            repoState.lock.unlock();
        }
        deliver(next);
    }

    private double queuedTotal() {
        int queued = 0;
        for (RepositoryState repoState : state.all()) {
            repoState.lock.lock();
            try {
                queued += repoState.queuedCount();
            } finally {
                repoState.lock.unlock();
            }
        }
        return queued;
    }

    private RepositoryStatus snapshot(RepositoryState repoState) {
        Instant now = clock.instant();
        List<RepositoryStatus.ActiveReservation> active = repoState.reservations().stream()
                .map(r -> new RepositoryStatus.ActiveReservation(r.agentType(), r.branchName(), r.unitId(),
                        r.unit().getTitle(), r.createdAt(), r.age(now).toMinutes()))
                .toList();
        Map<AgentRole, Integer> depth = new EnumMap<>(AgentRole.class);
        repoState.queueSnapshot().forEach((role, queue) -> depth.put(role, queue.size()));
        int queued = depth.values().stream().mapToInt(Integer::intValue).sum();
        return new RepositoryStatus(repoState.repository().fullName(), active, queued, depth, repoState.filesInUse());
    }

    /** {@code agents/<agent>/<last 6 of id>/<title slug>-<epoch millis>} */
    static String branchName(WorkUnit unit, AgentRole agentType, Instant at) {
        String id = slug(unit.getId());
        String shortId = id.length() > 6 ? id.substring(id.length() - 6) : id;
        String title = slug(unit.getTitle());
        if (title.length() > MAX_SLUG) {
            title = trimDashes(title.substring(0, MAX_SLUG));
        }
        if (title.isEmpty()) {
            title = "work";
        }
        return "agents/" + agentType.label() + "/" + shortId + "/" + title + "-" + at.toEpochMilli();
    }

    private static String slug(String text) {
        return trimDashes(NON_ALNUM.matcher(text.toLowerCase()).replaceAll("-"));
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
