package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * agents_cache 表 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentCachePO {

    private String agentId;
    private String owner;
    private String targetAddress;
    private String name;
    private String description;
    private String configIpfs;
    /** JSONB */
    private String abi;
    private Boolean active;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
