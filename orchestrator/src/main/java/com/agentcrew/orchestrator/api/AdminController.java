package com.agentcrew.orchestrator.api;

import com.agentcrew.orchestrator.api.dto.EmergencyCleanupRequest;
import com.agentcrew.orchestrator.api.dto.ForceReleaseRequest;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.reservation.RepositoryStatus;
import com.agentcrew.orchestrator.reservation.ReservationManager;
import com.agentcrew.orchestrator.reservation.ResolutionHistory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints. Each one is a direct pass-through to {@link ReservationManager}.
 *
 * GET  /admin/repositories                             : status of every busy repository
 * GET  /admin/repositories/{owner}/{name}              : one repository
 * GET  /admin/repositories/{owner}/{name}/resolutions  : recent conflict resolutions
 * POST /admin/branches/force-release                   : drop one reservation
 * POST /admin/emergency-cleanup                        : drop every reservation older than N minutes
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final ReservationManager reservations;

    public AdminController(ReservationManager reservations) {
        this.reservations = reservations;
    }

    @GetMapping("/repositories")
    public List<RepositoryStatus> repositories() {
        return reservations.getAllRepositoriesStatus();
    }

    @GetMapping("/repositories/{owner}/{name}")
    public RepositoryStatus repository(@PathVariable String owner, @PathVariable String name) {
        return reservations.getRepositoryStatus(new RepositoryRef(owner, name));
    }

    @GetMapping("/repositories/{owner}/{name}/resolutions")
    public List<ResolutionHistory.Entry> resolutions(@PathVariable String owner, @PathVariable String name) {
        return reservations.resolutionHistory(new RepositoryRef(owner, name));
    }

    @PostMapping("/branches/force-release")
    public Map<String, Object> forceRelease(@RequestBody ForceReleaseRequest req) {
        if (req.branchName() == null || req.branchName().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "branchName is required");
        }
        boolean released = reservations.forceReleaseBranch(req.branchName(), req.reason());
        return Map.of("branchName", req.branchName(), "released", released);
    }

    @PostMapping("/emergency-cleanup")
    public Map<String, Object> emergencyCleanup(@RequestBody(required = false) EmergencyCleanupRequest req) {
        long olderThan = req == null ? 30L : req.olderThanMinutes();
        if (olderThan < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "olderThanMinutes must not be negative");
        }
        int released = reservations.emergencyCleanup(olderThan);
        return Map.of("olderThanMinutes", olderThan, "released", released);
    }
}
