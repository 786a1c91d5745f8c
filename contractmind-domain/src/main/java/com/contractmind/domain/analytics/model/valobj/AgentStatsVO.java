package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 维度统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatsVO {

    private String agentId;

    private String agentName;

    private long totalCalls;

    private long uniqueUsers;

    private long totalGasUsed;

    private double successRate;

    private long averageGasPerCall;
}
