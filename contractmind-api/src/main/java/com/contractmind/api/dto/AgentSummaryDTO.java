package com.contractmind.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Agent 摘要 DTO。
 */
@Data
public class AgentSummaryDTO {

    private String agentId;
    private String name;
    private String description;
    private String owner;
    private String targetAddress;
    private Boolean active;
    private Integer functionCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
