package com.contractmind.api.dto;

import lombok.Data;

/**
 * 交易结果响应 DTO
 */
@Data
public class TransactionResultResponseDTO {

    private String response;

    /**
     * pending / success / failed
     */
    private String status;

    private String txHash;
    private Long blockNumber;
    private Long gasUsed;
}
