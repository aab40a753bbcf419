package com.ai.salesbot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthSnapshot {
    private long activeCalls;
    private long recentCalls;
    private int connectedClients;
    private long uptimeSeconds;
}
