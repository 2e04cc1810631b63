package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.model.Reservation;

/**
 * Invoked when a queued unit is admitted. The reservation has already been
 * taken on the unit's behalf. Called after the repository lock is released;
 * throwing hands the reservation back and lets the next waiter in.
 */
@FunctionalInterface
public interface AdmissionCallback {
    void admitted(Reservation reservation);
}
