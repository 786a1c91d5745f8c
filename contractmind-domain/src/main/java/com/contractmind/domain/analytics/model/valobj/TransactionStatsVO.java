package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易聚合统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionStatsVO {

    private long totalTransactions;

    private long successfulTransactions;

    private long uniqueUsers;

    private long totalGasUsed;

    private long averageGasUsed;

    /**
     * 0 ~ 1
     */
    private double successRate;

    public static TransactionStatsVO empty() {
        return new TransactionStatsVO();
    }
}
