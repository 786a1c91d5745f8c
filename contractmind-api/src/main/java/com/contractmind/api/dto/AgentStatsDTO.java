package com.contractmind.api.dto;

import lombok.Data;

/**
 * Agent 统计 DTO
 */
@Data
public class AgentStatsDTO {

    private String agentId;
    private String agentName;
    private Long totalCalls;
    private Long uniqueUsers;
    private Long totalGasUsed;
    private Double successRate;
    private Long averageGasPerCall;
}
