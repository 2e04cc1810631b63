package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.conflict.CompatibilityChecker;
import com.agentcrew.orchestrator.conflict.ConflictResolutionEngine;
import com.agentcrew.orchestrator.conflict.KeywordScopePredictor;
import com.agentcrew.orchestrator.conflict.PriorityCalculator;
import com.agentcrew.orchestrator.conflict.TaskContextExtractor;
import com.agentcrew.orchestrator.executor.ExecutorException;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.PipelineStage;
import com.agentcrew.orchestrator.model.Priority;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.StageState;
import com.agentcrew.orchestrator.model.TaskType;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.repository.PipelineStageRepository;
import com.agentcrew.orchestrator.repository.WorkUnitRepository;
import com.agentcrew.orchestrator.reservation.ReservationManager;
import com.agentcrew.orchestrator.reservation.ResolutionHistory;
import com.agentcrew.orchestrator.sourcehost.PullRequestRef;
import com.agentcrew.orchestrator.sourcehost.SourceHost;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.agentcrew.orchestrator.conflict.TestUnits.REPO;
import static com.agentcrew.orchestrator.conflict.TestUnits.dependsOn;
import static com.agentcrew.orchestrator.conflict.TestUnits.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs whole pipelines against in-memory repositories, a real reservation
 * manager and mocked executor and source host. The worker pool runs tasks
 * on the calling thread unless a test says otherwise.
 */
@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final List<String> CHANGED = List.of("src/checkout/copy.js");

    @Mock WorkUnitRepository      unitRepo;
    @Mock PipelineStageRepository stageRepo;
    @Mock StageExecutor           stageExecutor;
    @Mock SourceHost              sourceHost;

    private final Map<String, WorkUnit>    units  = new ConcurrentHashMap<>();
    private final Map<UUID, PipelineStage> stages = new ConcurrentHashMap<>();
    private final Map<AgentRole, Map<String, String>> contexts =
            Collections.synchronizedMap(new EnumMap<>(AgentRole.class));

    private SimpleMeterRegistry  registry;
    private ReservationManager   reservations;
    private PipelineService      pipelineService;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        lenient().when(unitRepo.save(any())).thenAnswer(inv -> {
            WorkUnit u = inv.getArgument(0);
            units.put(u.getId(), u);
            return u;
        });
        lenient().when(unitRepo.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(units.get(inv.<String>getArgument(0))));
        lenient().when(stageRepo.save(any())).thenAnswer(inv -> {
            PipelineStage s = inv.getArgument(0);
            stages.put(s.getId(), s);
            return s;
        });
        lenient().when(stageRepo.findById(any()))
                .thenAnswer(inv -> Optional.ofNullable(stages.get(inv.<UUID>getArgument(0))));
        lenient().when(stageRepo.findByUnitIdOrderByPositionAsc(anyString()))
                .thenAnswer(inv -> stagesOf(inv.getArgument(0)));
        lenient().when(sourceHost.createPullRequest(any(), anyString(), anyString(), anyString()))
                .thenReturn(new PullRequestRef(7, "https://github.com/acme/shop/pull/7"));

        Clock clock = Clock.systemUTC();
        registry = new SimpleMeterRegistry();
        TaskContextExtractor extractor = new TaskContextExtractor(new KeywordScopePredictor());
        reservations = new ReservationManager(new CompatibilityChecker(extractor),
                new ConflictResolutionEngine(extractor, new PriorityCalculator(clock), registry, clock),
                new ResolutionHistory(), registry, clock);
        pipelineService = new PipelineService(unitRepo, stageRepo, clock);
        orchestrator = orchestrator(Runnable::run, 60, 1000);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void start_allStagesSucceed_unitCompletes() throws Exception {
        submit("u1");
        answerEveryStage(CHANGED);

        PipelineRun run = orchestrator.start("u1");

        assertThat(run.completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);
        assertThat(units.get("u1").getStatus()).isEqualTo(WorkStatus.COMPLETED);
        assertThat(stagesOf("u1")).allMatch(s -> s.getState() == StageState.COMPLETED);

        // only the two code-mutating stages publish
        verify(sourceHost, times(2)).createBranch(eq(REPO), anyString());
        verify(sourceHost, times(2)).createPullRequest(eq(REPO), anyString(), eq("Tweak checkout copy"), anyString());
        PipelineStage senior = stagesOf("u1").get(3);
        assertThat(senior.getBranchName()).startsWith("agents/senior-developer/");
        assertThat(senior.getPullRequestUrl()).isEqualTo("https://github.com/acme/shop/pull/7");
        assertThat(stagesOf("u1").get(0).getBranchName()).isNull();

        assertThat(reservations.getRepositoryStatus(REPO).activeReservations()).isEmpty();
        assertThat(orchestrator.activeRun("u1")).isEmpty();
    }

    @Test
    void start_threadsEarlierOutputsIntoLaterStages() throws Exception {
        submit("u1");
        answerEveryStage(CHANGED);

        orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS);

        assertThat(contexts.get(AgentRole.PRODUCT_MANAGER)).isEmpty();
        assertThat(contexts.get(AgentRole.TECH_LEAD)).containsOnlyKeys("product-manager", "project-manager");
        assertThat(contexts.get(AgentRole.QA_ENGINEER)).hasSize(5)
                .containsEntry("senior-developer", "senior-developer output");
    }

    @Test
    void start_noFilesChanged_pushesBranchWithoutPullRequest() throws Exception {
        submit("u1");
        answerEveryStage(List.of());

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);

        verify(sourceHost, times(2)).createBranch(eq(REPO), anyString());
        verify(sourceHost, never()).createPullRequest(any(), anyString(), anyString(), anyString());
        assertThat(stagesOf("u1").get(4).getPullRequestUrl()).isNull();
    }

    @Test
    void start_recordsStageAndRunDurations() throws Exception {
        submit("u1");
        answerEveryStage(CHANGED);

        orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS);

        assertThat(registry.get("agentcrew.pipeline.stage.duration")
                .tag("role", "qa-engineer").tag("outcome", "completed").timer().count()).isEqualTo(1);
        assertThat(registry.get("agentcrew.pipeline.run.duration")
                .tag("outcome", "completed").timer().count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void start_executorUnreachable_failsUnitAndReleasesBranch() throws Exception {
        submit("u1");
        when(stageExecutor.execute(any(), any(), anyString(), anyMap())).thenAnswer(inv -> {
            AgentRole role = inv.getArgument(1);
            if (role == AgentRole.SENIOR_DEVELOPER) {
                throw new ExecutorException("u1", role, "engine unreachable: Connection refused", null);
            }
            return StageResult.success(role.label() + " output", CHANGED);
        });

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.FAILED);

        PipelineStage senior = stagesOf("u1").get(3);
        assertThat(senior.getState()).isEqualTo(StageState.FAILED);
        assertThat(senior.getError()).contains("could not reach the executor").contains("Connection refused");
        assertThat(stagesOf("u1").get(4).getState()).isEqualTo(StageState.PENDING);
        verify(stageExecutor, never()).execute(any(), eq(AgentRole.JUNIOR_DEVELOPER), anyString(), anyMap());
        verify(sourceHost, never()).createBranch(any(), anyString());
        assertThat(reservations.getRepositoryStatus(REPO).activeReservations()).isEmpty();
        assertThat(registry.get("agentcrew.pipeline.stage.duration")
                .tag("role", "senior-developer").tag("outcome", "failed").timer().count()).isEqualTo(1);
    }

    @Test
    void start_stageReportsFailure_stopsPipeline() throws Exception {
        submit("u1");
        when(stageExecutor.execute(any(), any(), anyString(), anyMap())).thenAnswer(inv -> {
            AgentRole role = inv.getArgument(1);
            return role == AgentRole.TECH_LEAD
                    ? StageResult.failure("design rejected")
                    : StageResult.success(role.label() + " output", List.of());
        });

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.FAILED);

        assertThat(stagesOf("u1")).extracting(PipelineStage::getState).containsExactly(
                StageState.COMPLETED, StageState.COMPLETED, StageState.FAILED,
                StageState.PENDING, StageState.PENDING, StageState.PENDING);
        assertThat(stagesOf("u1").get(2).getError()).isEqualTo("tech-lead stage reported failure: design rejected");
    }

    @Test
    void start_unitWithoutRepository_failsAtFirstCodeStage() throws Exception {
        WorkUnit u = unit("u1", "Tweak checkout copy");
        u.setRepository(null);
        units.put("u1", u);
        answerEveryStage(CHANGED);

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.FAILED);

        assertThat(stagesOf("u1").get(3).getError()).contains("has no repository");
    }

    @Test
    void start_dependencyNotCompleted_isRejectedBeforeAnyStage() {
        submit("u1");
        units.put("u2", dependsOn(unit("u2", "Rename labels"), "u1"));

        assertThatThrownBy(() -> orchestrator.start("u2"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("u1 (PENDING)");

        assertThat(units.get("u2").getStatus()).isEqualTo(WorkStatus.PENDING);
        assertThat(stagesOf("u2")).isEmpty();
        assertThat(orchestrator.activeRun("u2")).isEmpty();
        verify(stageExecutor, never()).execute(any(), any(), anyString(), anyMap());
    }

    @Test
    void start_dependencyCompleted_runs() throws Exception {
        submit("u1");
        answerEveryStage(CHANGED);
        orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS);
        units.put("u2", dependsOn(unit("u2", "Rename labels"), "u1"));

        assertThat(orchestrator.start("u2").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);
    }

    @Test
    void start_twice_isRejected() throws Exception {
        submit("u1");
        answerEveryStage(CHANGED);
        orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> orchestrator.start("u1")).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancel_duringStage_stopsAtNextBoundary() throws Exception {
        submit("u1");
        when(stageExecutor.execute(any(), any(), anyString(), anyMap())).thenAnswer(inv -> {
            AgentRole role = inv.getArgument(1);
            if (role == AgentRole.PROJECT_MANAGER) {
                orchestrator.cancel("u1");
            }
            return StageResult.success(role.label() + " output", List.of());
        });

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.CANCELLED);

        // the stage in flight finishes, nothing after it starts
        assertThat(stagesOf("u1")).extracting(PipelineStage::getState).containsExactly(
                StageState.COMPLETED, StageState.COMPLETED, StageState.PENDING,
                StageState.PENDING, StageState.PENDING, StageState.PENDING);
        assertThat(units.get("u1").getStatus()).isEqualTo(WorkStatus.CANCELLED);
        verify(stageExecutor, never()).execute(any(), eq(AgentRole.TECH_LEAD), anyString(), anyMap());
    }

    @Test
    void cancel_finishedUnit_isRejected() throws Exception {
        submit("u1");
        answerEveryStage(List.of());
        orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> orchestrator.cancel("u1")).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Waiting for a branch
    // ------------------------------------------------------------------

    @Test
    void start_branchNeverFreed_failsAfterQueueWait() throws Exception {
        reservations.reserveBranch(unit("other", "Rename labels"), AgentRole.SENIOR_DEVELOPER, REPO);
        orchestrator = orchestrator(Runnable::run, 0, 10);
        submit("u1");
        answerEveryStage(CHANGED);

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.FAILED);

        assertThat(stagesOf("u1").get(3).getError())
                .isEqualTo("No senior-developer branch on acme/shop became available within 0 minutes");
        assertThat(reservations.getRepositoryStatus(REPO).queuedTasks()).isZero();
        assertThat(reservations.resolutionHistory(REPO)).hasSize(1);
    }

    @Test
    void start_branchFreedWhileQueued_admitsAndCompletes() throws Exception {
        Reservation held = reservations.reserveBranch(unit("other", "Rename labels"),
                AgentRole.SENIOR_DEVELOPER, REPO);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            orchestrator = orchestrator(pool, 1, 10);
            submit("u1");
            answerEveryStage(CHANGED);

            PipelineRun run = orchestrator.start("u1");
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (reservations.getRepositoryStatus(REPO).queuedTasks() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(reservations.getRepositoryStatus(REPO).queuedTasks()).isEqualTo(1);

            reservations.releaseBranch(held.branchName());

            assertThat(run.completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void start_busyAgentWithCapableAlternate_runsStageOnAlternateBranch() throws Exception {
        reservations.reserveBranch(unit("other", "Rename labels"), AgentRole.SENIOR_DEVELOPER, REPO);
        units.put("u1", unit("u1", "Polish checkout ui"));
        answerEveryStage(CHANGED);

        assertThat(orchestrator.start("u1").completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);

        assertThat(stagesOf("u1").get(3).getBranchName()).startsWith("agents/junior-developer/");
        assertThat(stagesOf("u1").get(4).getBranchName()).startsWith("agents/junior-developer/");
        verify(stageExecutor, times(2)).execute(any(), eq(AgentRole.JUNIOR_DEVELOPER), anyString(), anyMap());
        verify(stageExecutor, never()).execute(any(), eq(AgentRole.SENIOR_DEVELOPER), anyString(), anyMap());
        assertThat(reservations.getRepositoryStatus(REPO).queuedTasks()).isZero();
    }

    @Test
    void start_outranksHolderOfItsFiles_isAdmittedAheadOfEarlierWaiters() throws Exception {
        Reservation holder = reservations.reserveBranch(unit("B", "Adjust spacing", TaskType.FEATURE,
                Complexity.MODERATE, Priority.LOW, "src/checkout/a.js", "src/checkout/b.js"),
                AgentRole.JUNIOR_DEVELOPER, REPO);
        List<String> admitted = Collections.synchronizedList(new ArrayList<>());
        reservations.queueAgentTask(unit("W", "Rename labels", TaskType.FEATURE, Complexity.MODERATE,
                Priority.LOW, "src/checkout/a.js", "src/checkout/b.js"), AgentRole.SENIOR_DEVELOPER, REPO, r -> {
                    admitted.add("W");
                    reservations.releaseBranch(r.branchName());
                });
        units.put("C", unit("C", "Rework checkout totals", TaskType.FEATURE, Complexity.MODERATE,
                Priority.CRITICAL, "src/checkout/a.js", "src/checkout/b.js"));
        when(stageExecutor.execute(any(), any(), anyString(), anyMap())).thenAnswer(inv -> {
            AgentRole role = inv.getArgument(1);
            if (role == AgentRole.SENIOR_DEVELOPER) {
                admitted.add("C");
            }
            return StageResult.success(role.label() + " output", List.of());
        });
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            orchestrator = orchestrator(pool, 1, 10);

            PipelineRun run = orchestrator.start("C");
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (reservations.getRepositoryStatus(REPO).queuedTasks() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(reservations.getRepositoryStatus(REPO).queuedTasks()).isEqualTo(2);

            reservations.releaseBranch(holder.branchName());

            assertThat(run.completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.COMPLETED);
            assertThat(admitted).containsExactly("C", "W");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cancel_whileQueued_leavesQueue() throws Exception {
        reservations.reserveBranch(unit("other", "Rename labels"), AgentRole.SENIOR_DEVELOPER, REPO);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            orchestrator = orchestrator(pool, 1, 10);
            submit("u1");
            answerEveryStage(CHANGED);

            PipelineRun run = orchestrator.start("u1");
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (reservations.getRepositoryStatus(REPO).queuedTasks() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            orchestrator.cancel("u1");

            assertThat(run.completion().get(5, TimeUnit.SECONDS)).isEqualTo(WorkStatus.CANCELLED);
            assertThat(reservations.getRepositoryStatus(REPO).queuedTasks()).isZero();
            assertThat(stagesOf("u1").get(3).getError()).isEqualTo("Cancelled while waiting for a senior-developer branch");
        } finally {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineOrchestrator orchestrator(Executor workers, long queueWaitMinutes, long pollMillis) {
        return new PipelineOrchestrator(pipelineService, reservations, stageExecutor, sourceHost,
                new StageInstructions(), registry, workers, queueWaitMinutes, pollMillis);
    }

    private void submit(String id) {
        units.put(id, unit(id, "Tweak checkout copy"));
    }

    private void answerEveryStage(List<String> filesChanged) {
        when(stageExecutor.execute(any(), any(), anyString(), anyMap())).thenAnswer(inv -> {
            AgentRole role = inv.getArgument(1);
            Map<String, String> context = inv.getArgument(3);
            contexts.put(role, Map.copyOf(context));
            return StageResult.success(role.label() + " output", role.mutatesCode() ? filesChanged : List.of());
        });
    }

    private List<PipelineStage> stagesOf(String unitId) {
        return stages.values().stream()
                .filter(s -> s.getUnitId().equals(unitId))
                .sorted(Comparator.comparingInt(PipelineStage::getPosition))
                .toList();
    }
}
