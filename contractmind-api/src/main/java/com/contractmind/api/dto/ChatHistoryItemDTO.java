package com.contractmind.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 聊天历史条目 DTO。
 */
@Data
public class ChatHistoryItemDTO {

    private Long id;
    private String agentId;
    private String userAddress;
    private String role;
    private String message;
    private String functionName;
    private Boolean requiresTransaction;
    private String transactionHash;
    private LocalDateTime createdAt;
}
