package com.contractmind.api.dto;

import lombok.Data;

/**
 * 等待交易回执请求 DTO
 */
@Data
public class TransactionConfirmRequestDTO {

    private String txHash;
    private String userAddress;
    private String functionName;
}
