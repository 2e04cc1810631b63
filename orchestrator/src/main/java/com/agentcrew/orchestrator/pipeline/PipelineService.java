package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.PipelineStage;
import com.agentcrew.orchestrator.model.StageState;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.repository.PipelineStageRepository;
import com.agentcrew.orchestrator.repository.WorkUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence side of the unit and stage lifecycle.
 *
 * Every state change goes through the entities' transitionTo, so an illegal
 * move surfaces as IllegalStateException. The orchestrator calls one method
 * per transition and never holds a transaction open across a stage.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    // Stage order; every unit runs all of them.
    static final List<AgentRole> PIPELINE = List.of(
            AgentRole.PRODUCT_MANAGER,
            AgentRole.PROJECT_MANAGER,
            AgentRole.TECH_LEAD,
            AgentRole.SENIOR_DEVELOPER,
            AgentRole.JUNIOR_DEVELOPER,
            AgentRole.QA_ENGINEER
    );

    private static final int MAX_ERROR_LENGTH = 4000;

    private final WorkUnitRepository      unitRepo;
    private final PipelineStageRepository stageRepo;
    private final Clock                   clock;

    public PipelineService(WorkUnitRepository unitRepo,
                           PipelineStageRepository stageRepo,
                           Clock clock) {
        this.unitRepo  = unitRepo;
        this.stageRepo = stageRepo;
        this.clock     = clock;
    }

    // ------------------------------------------------------------------
    // Units
    // ------------------------------------------------------------------

    /** Persist a new unit, picking its agent type when none was assigned. */
    @Transactional
    public WorkUnit submit(WorkUnit unit) {
        if (unit.getAssignedAgent() == null) {
            unit.setAssignedAgent(AgentRole.defaultFor(unit.getComplexity(), unit.getType()));
        }
        WorkUnit saved = unitRepo.save(unit);
        log.info("Submitted unit {} '{}' ({} / {}, agent {})", saved.getId(), saved.getTitle(),
                saved.getType(), saved.getComplexity(), saved.getAssignedAgent().label());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<WorkUnit> findById(String unitId) {
        return unitRepo.findById(unitId);
    }

    @Transactional(readOnly = true)
    public List<WorkUnit> findByStatus(WorkStatus status) {
        return unitRepo.findByStatus(status);
    }

    /** Latest persisted state; the orchestrator calls this before every stage. */
    @Transactional(readOnly = true)
    public WorkUnit reload(String unitId) {
        return unitRepo.findById(unitId)
                .orElseThrow(() -> new NoSuchElementException("Unknown unit " + unitId));
    }

    /**
     * Persist the units of a batch plan. Originals absorbed into a merged unit
     * are cancelled when they have not started.
     */
    @Transactional
    public List<WorkUnit> savePlan(List<WorkUnit> units) {
        List<WorkUnit> saved = new ArrayList<>();
        for (WorkUnit unit : units) {
            if (unit.getAssignedAgent() == null) {
                unit.setAssignedAgent(AgentRole.defaultFor(unit.getComplexity(), unit.getType()));
            }
            saved.add(unitRepo.save(unit));
            for (String originId : unit.getOriginIds()) {
                unitRepo.findById(originId)
                        .filter(origin -> origin.getStatus() == WorkStatus.PENDING)
                        .ifPresent(origin -> {
                            origin.transitionTo(WorkStatus.CANCELLED);
                            unitRepo.save(origin);
                            log.info("Unit {} cancelled: merged into {}", originId, unit.getId());
                        });
            }
        }
        return saved;
    }

    /**
     * Move a PENDING unit to IN_PROGRESS and create its six stages.
     * Dependencies that are not units of this service are work outside it and are not checked.
     *
     * @throws IllegalStateException if the unit has already started or finished,
     *                               or a dependency has not completed
     */
    @Transactional
    public List<PipelineStage> initialize(String unitId) {
        WorkUnit unit = reload(unitId);
        List<String> unfinished = unit.getDependencies().stream()
                .map(unitRepo::findById)
                .flatMap(Optional::stream)
                .filter(dep -> dep.getStatus() != WorkStatus.COMPLETED)
                .map(dep -> dep.getId() + " (" + dep.getStatus() + ")")
                .toList();
        if (!unfinished.isEmpty()) {
            throw new IllegalStateException("Unit " + unitId + " depends on unfinished units " + unfinished);
        }
        unit.transitionTo(WorkStatus.IN_PROGRESS);
        unitRepo.save(unit);

        List<PipelineStage> stages = new ArrayList<>();
        for (int i = 0; i < PIPELINE.size(); i++) {
            stages.add(stageRepo.save(new PipelineStage(unitId, i, PIPELINE.get(i))));
        }
        log.info("Unit {} started with {} stages", unitId, stages.size());
        return stages;
    }

    /**
     * Finish a unit whose stages all completed. A unit cancelled meanwhile
     * keeps its terminal state.
     */
    @Transactional
    public WorkStatus completeUnit(String unitId) {
        WorkUnit unit = reload(unitId);
        if (unit.getStatus().isTerminal()) {
            return unit.getStatus();
        }
        unit.transitionTo(WorkStatus.COMPLETED);
        unitRepo.save(unit);
        log.info("Unit {} COMPLETED", unitId);
        return WorkStatus.COMPLETED;
    }

    /**
     * @throws IllegalStateException if the unit is already terminal
     */
    @Transactional
    public WorkUnit cancel(String unitId) {
        WorkUnit unit = reload(unitId);
        unit.transitionTo(WorkStatus.CANCELLED);
        log.info("Unit {} CANCELLED", unitId);
        return unitRepo.save(unit);
    }

    /** Mark a unit that never got a stage running as failed. */
    @Transactional
    public void abort(String unitId, String reason) {
        WorkUnit unit = reload(unitId);
        if (unit.getStatus() == WorkStatus.IN_PROGRESS) {
            unit.transitionTo(WorkStatus.FAILED);
            unitRepo.save(unit);
            log.error("Unit {} FAILED before any stage ran: {}", unitId, reason);
        }
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<PipelineStage> getStages(String unitId) {
        return stageRepo.findByUnitIdOrderByPositionAsc(unitId);
    }

    @Transactional
    public PipelineStage startStage(UUID stageId) {
        PipelineStage stage = stage(stageId);
        stage.transitionTo(StageState.IN_PROGRESS);
        stage.setStartedAt(clock.instant());
        return stageRepo.save(stage);
    }

    @Transactional
    public PipelineStage completeStage(UUID stageId, StageResult result, String branchName, String pullRequestUrl) {
        PipelineStage stage = stage(stageId);
        stage.transitionTo(StageState.COMPLETED);
        stage.setFinishedAt(clock.instant());
        stage.setOutput(result.output());
        stage.setFilesChanged(result.filesChanged());
        stage.setBranchName(branchName);
        stage.setPullRequestUrl(pullRequestUrl);
        log.info("Stage {} of unit {} completed ({} files changed)",
                stage.getRole().label(), stage.getUnitId(), result.filesChanged().size());
        return stageRepo.save(stage);
    }

    /**
     * Fail a stage and, with it, the unit. A unit that is no longer in
     * progress (cancelled while the stage ran) keeps its state.
     */
    @Transactional
    public PipelineStage failStage(UUID stageId, String error) {
        PipelineStage stage = stage(stageId);
        if (stage.getState() == StageState.PENDING) {
            stage.transitionTo(StageState.IN_PROGRESS);
            stage.setStartedAt(clock.instant());
        }
        stage.transitionTo(StageState.FAILED);
        stage.setFinishedAt(clock.instant());
        stage.setError(truncate(error));
        stageRepo.save(stage);

        WorkUnit unit = reload(stage.getUnitId());
        if (unit.getStatus() == WorkStatus.IN_PROGRESS) {
            unit.transitionTo(WorkStatus.FAILED);
            unitRepo.save(unit);
            log.error("Stage {} failed. Unit {} → FAILED: {}", stage.getRole().label(), unit.getId(), error);
        } else {
            log.warn("Stage {} of unit {} failed while unit was {}: {}",
                    stage.getRole().label(), unit.getId(), unit.getStatus(), error);
        }
        return stage;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineStage stage(UUID stageId) {
        return stageRepo.findById(stageId)
                .orElseThrow(() -> new NoSuchElementException("Unknown stage " + stageId));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
