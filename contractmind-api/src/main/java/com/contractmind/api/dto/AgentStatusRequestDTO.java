package com.contractmind.api.dto;

import lombok.Data;

/**
 * Agent 启停请求 DTO
 */
@Data
public class AgentStatusRequestDTO {

    private Boolean active;
}
