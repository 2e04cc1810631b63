package com.agentcrew.orchestrator.api;

import com.agentcrew.orchestrator.api.dto.CreateWorkUnitRequest;
import com.agentcrew.orchestrator.api.dto.StageResponse;
import com.agentcrew.orchestrator.api.dto.WorkUnitResponse;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.pipeline.PipelineOrchestrator;
import com.agentcrew.orchestrator.pipeline.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * REST API for the unit lifecycle.
 *
 * POST /units             : submit a new unit of work (PENDING)
 * GET  /units?status=...  : list units in one state
 * GET  /units/{id}        : current state of a unit
 * GET  /units/{id}/stages : the six pipeline stages with their outputs
 * POST /units/{id}/start  : run the pipeline in the background
 * POST /units/{id}/cancel : cancel; takes effect at the next stage boundary
 */
@RestController
@RequestMapping("/units")
public class WorkUnitController {

    private final PipelineService      pipelineService;
    private final PipelineOrchestrator orchestrator;

    public WorkUnitController(PipelineService pipelineService, PipelineOrchestrator orchestrator) {
        this.pipelineService = pipelineService;
        this.orchestrator    = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/units \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"Fix login redirect","repository":"acme/webapp","type":"BUG","files":["src/auth/login.js"]}'
     */
    @PostMapping
    public ResponseEntity<WorkUnitResponse> submit(@RequestBody CreateWorkUnitRequest req) {
        if (req.title() == null || req.title().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title is required");
        }
        RepositoryRef repo;
        try {
            repo = RepositoryRef.parse(req.repository() == null ? "" : req.repository());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        WorkUnit unit = new WorkUnit(req.title(), req.description(), req.type(), req.complexity());
        unit.setRepository(repo);
        unit.setPriority(req.priority());
        unit.setAssignedAgent(req.assignedAgent());
        unit.setDeadline(req.deadline());
        unit.setDependencies(new LinkedHashSet<>(req.dependencies()));
        unit.setExplicitFiles(new LinkedHashSet<>(req.files()));

        WorkUnit saved = pipelineService.submit(unit);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkUnitResponse.from(saved));
    }

    @GetMapping
    public List<WorkUnitResponse> list(@RequestParam(defaultValue = "PENDING") WorkStatus status) {
        return pipelineService.findByStatus(status).stream()
                .map(WorkUnitResponse::from)
                .toList();
    }

    /** Returns 404 if the unit is not found. */
    @GetMapping("/{id}")
    public WorkUnitResponse getUnit(@PathVariable String id) {
        return WorkUnitResponse.from(requireUnit(id));
    }

    @GetMapping("/{id}/stages")
    public List<StageResponse> getStages(@PathVariable String id) {
        requireUnit(id);
        return pipelineService.getStages(id).stream()
                .map(StageResponse::from)
                .toList();
    }

    /**
     * HTTP 202: pipeline accepted and running
     * HTTP 404: unit not found
     * HTTP 409: unit already started or finished, or a dependency has not completed
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<WorkUnitResponse> start(@PathVariable String id) {
        requireUnit(id);
        try {
            orchestrator.start(id);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
        return ResponseEntity.accepted().body(WorkUnitResponse.from(requireUnit(id)));
    }

    /** HTTP 409 if the unit is already completed, failed or cancelled. */
    @PostMapping("/{id}/cancel")
    public WorkUnitResponse cancel(@PathVariable String id) {
        requireUnit(id);
        try {
            return WorkUnitResponse.from(orchestrator.cancel(id));
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
    }

    private WorkUnit requireUnit(String id) {
        return pipelineService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Unit not found: " + id));
    }
}
