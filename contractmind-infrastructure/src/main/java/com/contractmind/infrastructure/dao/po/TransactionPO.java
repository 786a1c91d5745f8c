package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * transactions 表 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionPO {

    private Long id;
    private String txHash;
    private String userAddress;
    private String agentId;
    private String targetAddress;
    private String functionName;
    private String calldata;
    private String executionMode;
    private String status;
    private Long blockNumber;
    private Long gasUsed;
    private String gasPrice;
    private String intentAction;
    private String intentProtocol;
    private String intentAmount;
    private BigDecimal intentConfidence;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime confirmedAt;
}
