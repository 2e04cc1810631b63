package com.agentcrew.orchestrator.reservation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically releases reservations held longer than any stage should take.
 * Stuck processes are the only way a reservation goes stale, and this is the
 * only place that handles it.
 */
@Component
@EnableScheduling
public class StaleReservationSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleReservationSweeper.class);

    private final ReservationManager reservations;
    private final long               staleAfterMinutes;

    public StaleReservationSweeper(ReservationManager reservations,
                                   @Value("${agentcrew.reservations.stale-after-minutes:120}") long staleAfterMinutes) {
        this.reservations      = reservations;
        this.staleAfterMinutes = staleAfterMinutes;
    }

    @Scheduled(fixedDelayString = "${agentcrew.reservations.sweep-interval-ms:300000}")
    public void sweep() {
        int released = reservations.emergencyCleanup(staleAfterMinutes);
        if (released > 0) {
            log.warn("Sweeper released {} stale reservations", released);
        }
    }
}
