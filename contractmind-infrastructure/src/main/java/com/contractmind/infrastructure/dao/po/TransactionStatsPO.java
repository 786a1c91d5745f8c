package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * transactions 聚合查询结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionStatsPO {

    private Long totalTransactions;
    private Long successfulTransactions;
    private Long uniqueUsers;
    private Long totalGasUsed;
    private BigDecimal averageGasUsed;
    private BigDecimal successRate;
}
