package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.conflict.Resolution;
import com.agentcrew.orchestrator.conflict.ResolutionAction;
import com.agentcrew.orchestrator.conflict.ResolutionAction.Preempt;
import com.agentcrew.orchestrator.conflict.ResolutionAction.Reassign;
import com.agentcrew.orchestrator.conflict.ResolutionOptions;
import com.agentcrew.orchestrator.executor.ExecutorException;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.PipelineStage;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.reservation.AdmissionCallback;
import com.agentcrew.orchestrator.reservation.QueuedTask;
import com.agentcrew.orchestrator.reservation.ReservationManager;
import com.agentcrew.orchestrator.reservation.TaskConflictException;
import com.agentcrew.orchestrator.sourcehost.PullRequestRef;
import com.agentcrew.orchestrator.sourcehost.SourceHost;
import com.agentcrew.orchestrator.sourcehost.SourceHostException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a unit through its six stages on the pipeline worker pool.
 *
 * Before each stage the unit is reloaded so a cancellation made through the
 * API is seen at the next stage boundary; a stage already handed to the
 * engine always runs to completion. Code-mutating stages hold a branch
 * reservation for exactly the duration of the stage. A failed stage fails
 * the unit and no further stages run.
 *
 * A unit only starts once every declared dependency has completed.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    // A running unit cannot be split or merged; its earlier stages covered all of it.
    static final ResolutionOptions RUNTIME_OPTIONS = new ResolutionOptions(false, false);

    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();

    private final PipelineService    pipelineService;
    private final ReservationManager reservations;
    private final StageExecutor      stageExecutor;
    private final SourceHost         sourceHost;
    private final StageInstructions  instructions;
    private final MeterRegistry      meterRegistry;
    private final Executor           workers;
    private final long               queueWaitMillis;
    private final long               queuePollMillis;

    public PipelineOrchestrator(PipelineService pipelineService,
                                ReservationManager reservations,
                                StageExecutor stageExecutor,
                                SourceHost sourceHost,
                                StageInstructions instructions,
                                MeterRegistry meterRegistry,
                                @Qualifier("pipelineExecutor") Executor workers,
                                @Value("${agentcrew.pipeline.queue-wait-minutes:60}") long queueWaitMinutes,
                                @Value("${agentcrew.pipeline.queue-poll-millis:1000}") long queuePollMillis) {
        this.pipelineService = pipelineService;
        this.reservations    = reservations;
        this.stageExecutor   = stageExecutor;
        this.sourceHost      = sourceHost;
        this.instructions    = instructions;
        this.meterRegistry   = meterRegistry;
        this.workers         = workers;
        this.queueWaitMillis = TimeUnit.MINUTES.toMillis(queueWaitMinutes);
        this.queuePollMillis = queuePollMillis;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Start a PENDING unit. Returns at once; the pipeline runs on the worker pool.
     *
     * @throws IllegalStateException if the unit is not PENDING or a dependency has not completed
     */
    public PipelineRun start(String unitId) {
        pipelineService.initialize(unitId);

        PipelineRun run = new PipelineRun(unitId, new CancellationToken(), new CompletableFuture<>());
        runs.put(unitId, run);
        try {
            workers.execute(() -> {
                Timer.Sample sample = Timer.start(meterRegistry);
                String outcome = "aborted";
                try {
                    WorkStatus status = runStages(unitId, run.token());
                    outcome = status.name().toLowerCase();
                    run.completion().complete(status);
                } catch (RuntimeException e) {
                    log.error("Pipeline for unit {} aborted: {}", unitId, e.getMessage(), e);
                    run.completion().completeExceptionally(e);
                } finally {
                    runs.remove(unitId);
                    sample.stop(meterRegistry.timer("agentcrew.pipeline.run.duration", "outcome", outcome));
                }
            });
        } catch (RejectedExecutionException e) {
            runs.remove(unitId);
            pipelineService.abort(unitId, "worker pool rejected the pipeline");
            throw e;
        }
        return run;
    }

    /**
     * Persist CANCELLED and signal the running pipeline, if any.
     *
     * @throws IllegalStateException if the unit is already terminal
     */
    public WorkUnit cancel(String unitId) {
        WorkUnit unit = pipelineService.cancel(unitId);
        PipelineRun run = runs.get(unitId);
        if (run != null) {
            run.token().cancel();
        }
        return unit;
    }

    public Optional<PipelineRun> activeRun(String unitId) {
        return Optional.ofNullable(runs.get(unitId));
    }

    // ------------------------------------------------------------------
    // Stage loop
    // ------------------------------------------------------------------

    WorkStatus runStages(String unitId, CancellationToken token) {
        Map<String, String> context = new LinkedHashMap<>();
        List<PipelineStage> stages = pipelineService.getStages(unitId);

        for (PipelineStage stage : stages) {
            WorkUnit unit = pipelineService.reload(unitId);
            if (token.isCancelled() || unit.getStatus() == WorkStatus.CANCELLED) {
                log.info("Unit {} cancelled before stage {}", unitId, stage.getRole().label());
                return WorkStatus.CANCELLED;
            }
            if (unit.getStatus() != WorkStatus.IN_PROGRESS) {
                return unit.getStatus();
            }
            if (!runStage(unit, stage, context, token)) {
                return pipelineService.reload(unitId).getStatus();
            }
        }
        return pipelineService.completeUnit(unitId);
    }

    /** @return whether the stage completed */
    private boolean runStage(WorkUnit unit, PipelineStage stage, Map<String, String> context,
                             CancellationToken token) {
        AgentRole role = stage.getRole();
        MDC.put("unitId", unit.getId());
        MDC.put("stage",  String.valueOf(stage.getPosition()));
        MDC.put("role",   role.label());

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failed";
        Reservation reservation = null;
        try {
            pipelineService.startStage(stage.getId());
            if (role.mutatesCode()) {
                reservation = acquire(unit, role, token);
            }

            // a reassigned stage runs as the agent that holds the branch
            AgentRole agent = reservation != null ? reservation.agentType() : role;
            StageResult result = execute(unit, role, agent, context);
            if (!result.success()) {
                throw new StageExecutionException(role.label() + " stage reported failure: " + result.error());
            }

            String branch = null;
            String pullRequestUrl = null;
            if (reservation != null) {
                branch = reservation.branchName();
                pullRequestUrl = publish(unit, agent, branch, result);
            }
            pipelineService.completeStage(stage.getId(), result, branch, pullRequestUrl);
            if (result.output() != null) {
                context.put(role.label(), result.output());
            }
            outcome = "completed";
            return true;

        } catch (StageExecutionException e) {
            log.error("Stage {} of unit {} failed: {}", role.label(), unit.getId(), e.getMessage());
            pipelineService.failStage(stage.getId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error in stage {} of unit {}", role.label(), unit.getId(), e);
            pipelineService.failStage(stage.getId(), "Unexpected error: " + e.getMessage());
            return false;
        } finally {
            if (reservation != null) {
                reservations.releaseBranch(reservation.branchName());
            }
            sample.stop(meterRegistry.timer("agentcrew.pipeline.stage.duration",
                    "role", role.label(), "outcome", outcome));
            MDC.clear();
        }
    }

    private StageResult execute(WorkUnit unit, AgentRole role, AgentRole agent, Map<String, String> context) {
        try {
            return stageExecutor.execute(unit, agent, instructions.forStage(role, unit),
                    Collections.unmodifiableMap(new LinkedHashMap<>(context)));
        } catch (ExecutorException e) {
            log.warn("Engine gave no answer for {} (unit {}, HTTP status {})",
                    e.agentType().label(), e.unitId(), e.statusCode());
            throw new StageExecutionException(role.label() + " stage could not reach the executor: "
                    + e.getMessage(), e);
        }
    }

    /** Push the stage's branch and, when it changed files, open a pull request. */
    private String publish(WorkUnit unit, AgentRole role, String branch, StageResult result) {
        RepositoryRef repo = unit.repository();
        try {
            sourceHost.createBranch(repo, branch);
            if (result.filesChanged().isEmpty()) {
                return null;
            }
            PullRequestRef pr = sourceHost.createPullRequest(repo, branch, unit.getTitle(),
                    pullRequestBody(unit, role, result));
            return pr.url();
        } catch (SourceHostException e) {
            throw new StageExecutionException("Publishing " + branch + " failed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Reservation
    // ------------------------------------------------------------------

    /**
     * Reserve the stage's branch. On conflict the resolution engine is asked
     * for a remedy, which is then carried out by {@link #apply}.
     */
    private Reservation acquire(WorkUnit unit, AgentRole role, CancellationToken token) {
        RepositoryRef repo = unit.repository();
        if (repo == null) {
            throw new StageExecutionException("Unit " + unit.getId() + " has no repository to reserve a branch on");
        }
        try {
            return reservations.reserveBranch(unit, role, repo);
        } catch (TaskConflictException e) {
            Resolution resolution = reservations.resolveConflict(unit, role, repo, RUNTIME_OPTIONS);
            if (!resolution.resolved()) {
                throw new StageExecutionException("Unresolved " + e.getResult().reason().wireName()
                        + " conflict: " + resolution.suggestion());
            }
            return apply(unit, role, repo, resolution, token);
        }
    }

    /**
     * Reassignment takes the alternate agent's branch if it is still free.
     * Preemption puts the unit at the head of the queue: the outranked work
     * keeps its branch until its stage ends, since a stage handed to the
     * engine is never interrupted. Every other remedy (sequencing, waiting
     * for dependencies, coordination, plain queueing) waits in line for the
     * blocking work to release.
     */
    private Reservation apply(WorkUnit unit, AgentRole role, RepositoryRef repo, Resolution resolution,
                              CancellationToken token) {
        ResolutionAction action = resolution.action();
        if (action instanceof Reassign reassign) {
            try {
                Reservation reservation = reservations.reserveBranch(unit, reassign.to(), repo);
                log.info("Stage {} of unit {} handed to {} ({})", role.label(), unit.getId(),
                        reassign.to().label(), reassign.matchedCapabilities());
                return reservation;
            } catch (TaskConflictException e) {
                log.info("{} was taken before unit {} could use it, waiting for {}",
                        reassign.to().label(), unit.getId(), role.label());
                return awaitAdmission(unit, role, repo, token, false);
            }
        }
        if (action instanceof Preempt preempt) {
            log.info("Unit {} (priority {}) outranks {}, queued ahead of them",
                    unit.getId(), preempt.candidateScore(), preempt.preemptedUnitIds());
            return awaitAdmission(unit, role, repo, token, true);
        }
        log.info("Conflict for unit {} resolved by {}, waiting for admission",
                unit.getId(), resolution.strategy().wireName());
        return awaitAdmission(unit, role, repo, token, false);
    }

    private Reservation awaitAdmission(WorkUnit unit, AgentRole role, RepositoryRef repo, CancellationToken token,
                                       boolean ahead) {
        CompletableFuture<Reservation> admitted = new CompletableFuture<>();
        AdmissionCallback onAdmit = reservation -> {
            if (!admitted.complete(reservation)) {
                throw new IllegalStateException("Unit " + unit.getId() + " stopped waiting");
            }
        };
        QueuedTask task = ahead
                ? reservations.queueAgentTaskFirst(unit, role, repo, onAdmit)
                : reservations.queueAgentTask(unit, role, repo, onAdmit);
        reservations.processQueue(repo);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(queueWaitMillis);
        while (true) {
            try {
                return admitted.get(queuePollMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (token.isCancelled()) {
                    abandon(task, admitted);
                    throw new StageExecutionException("Cancelled while waiting for a " + role.label() + " branch");
                }
                if (System.nanoTime() - deadline > 0) {
                    abandon(task, admitted);
                    throw new StageExecutionException("No " + role.label() + " branch on " + repo
                            + " became available within " + TimeUnit.MILLISECONDS.toMinutes(queueWaitMillis)
                            + " minutes");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(task, admitted);
                throw new StageExecutionException("Interrupted while waiting for a branch", e);
            } catch (ExecutionException e) {
                throw new StageExecutionException("Admission failed", e.getCause());
            }
        }
    }

    /**
     * Leave the queue. If the unit was admitted meanwhile, whichever side
     * completes the future second hands the reservation back: here, or the
     * admission callback failing and rolling it back.
     */
    private void abandon(QueuedTask task, CompletableFuture<Reservation> admitted) {
        if (reservations.dequeue(task)) {
            return;
        }
        if (!admitted.completeExceptionally(new CancellationException("stopped waiting"))) {
            reservations.releaseBranch(admitted.join().branchName());
        }
    }

    private static String pullRequestBody(WorkUnit unit, AgentRole role, StageResult result) {
        StringBuilder body = new StringBuilder()
                .append("Changes by the ").append(role.label())
                .append(" agent for work unit `").append(unit.getId()).append("`.\n\n");
        if (unit.getDescription() != null && !unit.getDescription().isBlank()) {
            body.append(unit.getDescription()).append("\n\n");
        }
        body.append("Files changed:\n");
        result.filesChanged().forEach(f -> body.append("- ").append(f).append('\n'));
        return body.toString();
    }
}
