package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 全平台统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalStatsVO {

    private long totalTransactions;

    private long totalUsers;

    private long totalAgents;

    private long totalGasUsed;

    private double successRate;

    private long transactionsLast24h;

    private List<AgentUsageVO> topAgents;
}
