package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.RepositoryRef;
import com.agentcrew.orchestrator.model.Reservation;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of one repository's scheduling state.
 * Only the reservation manager can change what sits behind it.
 */
public interface ActiveWorkView {

    RepositoryRef repository();

    /** Every active reservation, one per active unit. */
    Collection<Reservation> reservations();

    Optional<Reservation> reservationFor(AgentRole agentType);

    Optional<Reservation> activeUnit(String unitId);

    /** Ids of the active units that claimed {@code file}. */
    Set<String> claimantsOf(String file);

    int queueDepth(AgentRole agentType);
}
