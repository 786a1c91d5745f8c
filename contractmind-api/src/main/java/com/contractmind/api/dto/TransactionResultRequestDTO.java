package com.contractmind.api.dto;

import lombok.Data;

/**
 * 前端签名广播后回报交易哈希的请求。
 */
@Data
public class TransactionResultRequestDTO {

    private String txHash;
    private String userAddress;
    private String agentId;
    private String functionName;
    private String targetAddress;
}
