package com.contractmind.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 用户统计 DTO
 */
@Data
public class UserStatsDTO {

    private String userAddress;
    private Long totalTransactions;
    private Long totalGasUsed;
    private Double successRate;
    private List<AgentUsageDTO> favoriteAgents;
    private List<ActivityDTO> recentActivity;
}
