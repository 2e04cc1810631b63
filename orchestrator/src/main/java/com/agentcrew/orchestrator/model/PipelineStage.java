package com.agentcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One agent-role execution within a unit's pipeline.
 *
 * Stages are created together when the pipeline starts and run strictly
 * in {@code position} order. Code-mutating stages record the branch they
 * reserved and, when files changed, the pull request opened for it.
 *
 * DB table: pipeline_stages  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_stages")
public class PipelineStage {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "unit_id", nullable = false)
    private String unitId;

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentRole role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageState state = StageState.PENDING;

    @Column(name = "branch_name")
    private String branchName;

    @Column(name = "pull_request_url")
    private String pullRequestUrl;

    // Executor output; threaded into the next stage's context.
    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(columnDefinition = "TEXT")
    private String error;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pipeline_stage_files", joinColumns = @JoinColumn(name = "stage_id"))
    @Column(name = "path", nullable = false)
    private List<String> filesChanged = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineStage() {}   // required by JPA

    public PipelineStage(String unitId, int position, AgentRole role) {
        this.id       = UUID.randomUUID();
        this.unitId   = unitId;
        this.position = position;
        this.role     = role;
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(StageState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Stage " + role + " of unit " + unitId + " cannot move from " + state + " to " + next);
        }
        this.state = next;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()             { return id; }
    public String       getUnitId()         { return unitId; }
    public int          getPosition()       { return position; }
    public AgentRole    getRole()           { return role; }
    public StageState   getState()          { return state; }
    public String       getBranchName()     { return branchName; }
    public String       getPullRequestUrl() { return pullRequestUrl; }
    public String       getOutput()         { return output; }
    public String       getError()          { return error; }
    public List<String> getFilesChanged()   { return filesChanged; }
    public Instant      getCreatedAt()      { return createdAt; }
    public Instant      getStartedAt()      { return startedAt; }
    public Instant      getFinishedAt()     { return finishedAt; }

    public void setBranchName(String branchName)         { this.branchName = branchName; }
    public void setPullRequestUrl(String url)            { this.pullRequestUrl = url; }
    public void setOutput(String output)                 { this.output = output; }
    public void setError(String error)                   { this.error = error; }
    public void setFilesChanged(List<String> files)      { this.filesChanged = new ArrayList<>(files); }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void setFinishedAt(Instant t)                 { this.finishedAt = t; }
}
