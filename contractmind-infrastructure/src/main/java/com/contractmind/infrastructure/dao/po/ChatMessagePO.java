package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * chat_messages 表 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessagePO {

    private Long id;
    private String agentId;
    private String userAddress;
    /** user / assistant */
    private String role;
    private String message;
    private String functionName;
    private Boolean requiresTransaction;
    private String transactionHash;
    private LocalDateTime createdAt;
}
