package com.contractmind.api.dto;

import lombok.Data;

/**
 * Agent 调用次数 DTO
 */
@Data
public class AgentUsageDTO {

    private String name;
    private Long count;
}
