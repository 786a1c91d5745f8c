package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 用户维度统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStatsVO {

    private String userAddress;

    private long totalTransactions;

    private long totalGasUsed;

    private double successRate;

    private List<AgentUsageVO> favoriteAgents;

    private List<ActivityVO> recentActivity;
}
