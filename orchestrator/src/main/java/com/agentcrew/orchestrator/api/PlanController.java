package com.agentcrew.orchestrator.api;

import com.agentcrew.orchestrator.api.dto.PlanRequest;
import com.agentcrew.orchestrator.api.dto.PlanResponse;
import com.agentcrew.orchestrator.conflict.ResolutionOptions;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.pipeline.PipelineService;
import com.agentcrew.orchestrator.planning.BatchPlan;
import com.agentcrew.orchestrator.planning.BatchPlanner;
import com.agentcrew.orchestrator.planning.DependencyCycleException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * POST /plans: plan a batch of PENDING units: resolve their overlaps,
 * persist the added dependencies and merged units, and return the order.
 *
 * HTTP 404: an id is unknown
 * HTTP 409: a unit is no longer PENDING
 * HTTP 422: the declared dependencies form a cycle
 */
@RestController
@RequestMapping("/plans")
public class PlanController {

    private final PipelineService pipelineService;
    private final BatchPlanner    batchPlanner;

    public PlanController(PipelineService pipelineService, BatchPlanner batchPlanner) {
        this.pipelineService = pipelineService;
        this.batchPlanner    = batchPlanner;
    }

    @PostMapping
    public PlanResponse plan(@RequestBody PlanRequest req) {
        if (req.unitIds().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unitIds must not be empty");
        }
        List<WorkUnit> units = new ArrayList<>();
        for (String id : req.unitIds()) {
            WorkUnit unit = pipelineService.findById(id).orElseThrow(() ->
                    new ResponseStatusException(HttpStatus.NOT_FOUND, "Unit not found: " + id));
            if (unit.getStatus() != WorkStatus.PENDING) {
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "Unit " + id + " is " + unit.getStatus() + ", only PENDING units can be planned");
            }
            units.add(unit);
        }

        BatchPlan plan;
        try {
            plan = batchPlanner.plan(units, new ResolutionOptions(true, req.allowMerge()));
        } catch (DependencyCycleException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Dependency cycle among units " + e.getCycleNodes(), e);
        }
        pipelineService.savePlan(plan.units());
        return PlanResponse.from(plan);
    }
}
