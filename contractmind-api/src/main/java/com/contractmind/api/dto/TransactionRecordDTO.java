package com.contractmind.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 交易记录 DTO。
 */
@Data
public class TransactionRecordDTO {

    private String txHash;
    private String userAddress;
    private String agentId;
    private String targetAddress;
    private String functionName;
    private String executionMode;
    private String status;
    private Long blockNumber;
    private Long gasUsed;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime confirmedAt;
}
