package com.agentcrew.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One schedulable unit of work routed through the agent pipeline.
 *
 * Created by the planning layer (or the REST surface), mutated by the
 * pipeline as stages progress, and retired once it reaches a terminal status.
 * Ids are assigned by the application so that derived units (split parts,
 * merged units) can carry readable ids.
 *
 * DB table: work_units  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "work_units")
public class WorkUnit {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskType type = TaskType.FEATURE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Complexity complexity = Complexity.MODERATE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Priority priority = Priority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_agent")
    private AgentRole assignedAgent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkStatus status = WorkStatus.PENDING;

    @Column(name = "repo_owner")
    private String repoOwner;

    @Column(name = "repo_name")
    private String repoName;

    private Instant deadline;

    // Set on split parts; points at the unit they were carved out of.
    @Column(name = "parent_id")
    private String parentId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "work_unit_dependencies", joinColumns = @JoinColumn(name = "unit_id"))
    @Column(name = "depends_on", nullable = false)
    private Set<String> dependencies = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "work_unit_blocks", joinColumns = @JoinColumn(name = "unit_id"))
    @Column(name = "blocks_id", nullable = false)
    private Set<String> blocks = new LinkedHashSet<>();

    // Files the submitter declared up front; the extractor adds predicted ones on top.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "work_unit_files", joinColumns = @JoinColumn(name = "unit_id"))
    @Column(name = "path", nullable = false)
    private Set<String> explicitFiles = new LinkedHashSet<>();

    // Ids of the units a merged unit was built from.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "work_unit_origins", joinColumns = @JoinColumn(name = "unit_id"))
    @Column(name = "origin_id", nullable = false)
    private Set<String> originIds = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkUnit() {}   // required by JPA

    public WorkUnit(String title, String description, TaskType type, Complexity complexity) {
        this(UUID.randomUUID().toString(), title, description, type, complexity);
    }

    public WorkUnit(String id, String title, String description, TaskType type, Complexity complexity) {
        this.id          = id;
        this.title       = title;
        this.description = description;
        this.type        = type;
        this.complexity  = complexity;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}, enforcing the transitions declared on {@link WorkStatus}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(WorkStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Unit " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public RepositoryRef repository() {
        return repoOwner == null || repoName == null ? null : new RepositoryRef(repoOwner, repoName);
    }

    /** Agent type that runs this unit, falling back to the complexity/type default. */
    public AgentRole effectiveAgent() {
        return assignedAgent != null ? assignedAgent : AgentRole.defaultFor(complexity, type);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String      getId()            { return id; }
    public Long        getVersion()       { return version; }
    public String      getTitle()         { return title; }
    public String      getDescription()   { return description; }
    public TaskType    getType()          { return type; }
    public Complexity  getComplexity()    { return complexity; }
    public Priority    getPriority()      { return priority; }
    public AgentRole   getAssignedAgent() { return assignedAgent; }
    public WorkStatus  getStatus()        { return status; }
    public String      getRepoOwner()     { return repoOwner; }
    public String      getRepoName()      { return repoName; }
    public Instant     getDeadline()      { return deadline; }
    public String      getParentId()      { return parentId; }
    public Set<String> getDependencies()  { return dependencies; }
    public Set<String> getBlocks()        { return blocks; }
    public Set<String> getExplicitFiles() { return explicitFiles; }
    public Set<String> getOriginIds()     { return originIds; }
    public Instant     getCreatedAt()     { return createdAt; }
    public Instant     getUpdatedAt()     { return updatedAt; }

    public void setPriority(Priority priority)             { this.priority = priority; }
    public void setAssignedAgent(AgentRole assignedAgent)  { this.assignedAgent = assignedAgent; }
    public void setDeadline(Instant deadline)              { this.deadline = deadline; }
    public void setParentId(String parentId)               { this.parentId = parentId; }

    public void setRepository(RepositoryRef repo) {
        this.repoOwner = repo == null ? null : repo.owner();
        this.repoName  = repo == null ? null : repo.name();
    }

    public void setDependencies(Set<String> ids)   { this.dependencies  = new LinkedHashSet<>(ids); }
    public void setBlocks(Set<String> ids)         { this.blocks        = new LinkedHashSet<>(ids); }
    public void setExplicitFiles(Set<String> paths) { this.explicitFiles = new LinkedHashSet<>(paths); }
    public void setOriginIds(Set<String> ids)      { this.originIds     = new LinkedHashSet<>(ids); }

    @Override
    public String toString() {
        return "WorkUnit[" + id + ", " + title + ", " + status + "]";
    }
}
