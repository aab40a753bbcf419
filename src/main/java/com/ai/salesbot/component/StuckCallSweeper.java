package com.ai.salesbot.component;

import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.service.CallSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic reclamation of calls stuck in progress. Listing active calls also reclaims, so
 * this only bounds staleness when nobody is reading.
 */
@Component
public class StuckCallSweeper {

    private static final Logger log = LoggerFactory.getLogger(StuckCallSweeper.class);

    private final CallSessionService callSessionService;

    public StuckCallSweeper(CallSessionService callSessionService) {
        this.callSessionService = callSessionService;
    }

    @Scheduled(fixedDelayString = "${salesbot.calls.sweep-interval-ms:60000}",
            initialDelayString = "${salesbot.calls.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            List<CallSession> reclaimed = callSessionService.reclaimStuck();
            if (!reclaimed.isEmpty()) {
                log.info("Stuck-call sweep reclaimed {} call(s)", reclaimed.size());
            }
        } catch (RuntimeException e) {
            log.error("Stuck-call sweep failed", e);
        }
    }
}
