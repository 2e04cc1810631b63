package com.agentcrew.orchestrator.api;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.reservation.RepositoryStatus;
import com.agentcrew.orchestrator.reservation.ReservationManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean ReservationManager reservations;

    @Test
    void repositories_listsBusyRepositories() throws Exception {
        RepositoryStatus.ActiveReservation active = new RepositoryStatus.ActiveReservation(
                AgentRole.SENIOR_DEVELOPER, "agents/senior-developer/u1/tweak-1", "u1", "Tweak copy",
                Instant.parse("2025-03-01T09:00:00Z"), 12);
        when(reservations.getAllRepositoriesStatus()).thenReturn(List.of(new RepositoryStatus(
                "acme/shop", List.of(active), 1, Map.of(AgentRole.SENIOR_DEVELOPER, 1), Set.of("src/a.js"))));

        mockMvc.perform(get("/admin/repositories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].repository").value("acme/shop"))
                .andExpect(jsonPath("$[0].activeReservations[0].branchName").value("agents/senior-developer/u1/tweak-1"))
                .andExpect(jsonPath("$[0].activeReservations[0].ageMinutes").value(12))
                .andExpect(jsonPath("$[0].queueDepth.SENIOR_DEVELOPER").value(1))
                .andExpect(jsonPath("$[0].filesInUse[0]").value("src/a.js"));
    }

    @Test
    void repository_returnsOneRepository() throws Exception {
        when(reservations.getRepositoryStatus(new RepositoryRef("acme", "shop")))
                .thenReturn(new RepositoryStatus("acme/shop", List.of(), 0, Map.of(), Set.of()));

        mockMvc.perform(get("/admin/repositories/{owner}/{name}", "acme", "shop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repository").value("acme/shop"))
                .andExpect(jsonPath("$.queuedTasks").value(0));
    }

    @Test
    void resolutions_emptyHistory_returnsEmptyList() throws Exception {
        when(reservations.resolutionHistory(new RepositoryRef("acme", "shop"))).thenReturn(List.of());

        mockMvc.perform(get("/admin/repositories/{owner}/{name}/resolutions", "acme", "shop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void forceRelease_knownBranch_reportsReleased() throws Exception {
        when(reservations.forceReleaseBranch("agents/x", "stuck engine")).thenReturn(true);

        mockMvc.perform(post("/admin/branches/force-release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"branchName":"agents/x","reason":"stuck engine"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.branchName").value("agents/x"))
                .andExpect(jsonPath("$.released").value(true));
    }

    @Test
    void forceRelease_defaultsReason() throws Exception {
        when(reservations.forceReleaseBranch("agents/x", "operator request")).thenReturn(false);

        mockMvc.perform(post("/admin/branches/force-release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"branchName":"agents/x"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.released").value(false));
    }

    @Test
    void forceRelease_missingBranch_returns400() throws Exception {
        mockMvc.perform(post("/admin/branches/force-release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(reservations, never()).forceReleaseBranch(anyString(), anyString());
    }

    @Test
    void emergencyCleanup_withoutBody_usesThirtyMinutes() throws Exception {
        when(reservations.emergencyCleanup(30)).thenReturn(2);

        mockMvc.perform(post("/admin/emergency-cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.olderThanMinutes").value(30))
                .andExpect(jsonPath("$.released").value(2));
    }

    @Test
    void emergencyCleanup_customThreshold() throws Exception {
        when(reservations.emergencyCleanup(90)).thenReturn(0);

        mockMvc.perform(post("/admin/emergency-cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"olderThanMinutes":90}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.released").value(0));
    }

    @Test
    void emergencyCleanup_negativeThreshold_returns400() throws Exception {
        mockMvc.perform(post("/admin/emergency-cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"olderThanMinutes":-5}
                                """))
                .andExpect(status().isBadRequest());

        verify(reservations, never()).emergencyCleanup(anyLong());
    }
}
