package com.contractmind.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 全平台统计 DTO
 */
@Data
public class GlobalStatsDTO {

    private Long totalTransactions;
    private Long totalUsers;
    private Long totalAgents;
    private Long totalGasUsed;
    private Double successRate;
    private Long transactionsLast24h;
    private List<AgentUsageDTO> topAgents;
}
