package com.ai.salesbot.component;

import com.ai.salesbot.dto.DashboardEvent;
import com.ai.salesbot.dto.HealthSnapshot;
import com.ai.salesbot.service.CallSessionService;
import com.ai.salesbot.websocket.EventBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SystemHealthPublisher {

    private static final Logger log = LoggerFactory.getLogger(SystemHealthPublisher.class);

    private final CallSessionService callSessionService;
    private final EventBroadcaster broadcaster;

    public SystemHealthPublisher(CallSessionService callSessionService, EventBroadcaster broadcaster) {
        this.callSessionService = callSessionService;
        this.broadcaster = broadcaster;
    }

    @Scheduled(fixedRateString = "${salesbot.broadcast.health-interval-ms:30000}")
    public void publish() {
        try {
            HealthSnapshot snapshot = callSessionService.health();
            broadcaster.publish(DashboardEvent.SYSTEM_HEALTH, null, snapshot);
        } catch (RuntimeException e) {
            log.error("Error broadcasting system health", e);
        }
    }
}
