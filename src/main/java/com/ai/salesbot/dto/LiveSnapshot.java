package com.ai.salesbot.dto;

import com.ai.salesbot.entity.CallSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveSnapshot {
    private int activeCount;
    private List<CallSession> activeCalls;
    private List<AnalyticsView> recentActivity;
    private Instant generatedAt;
}
