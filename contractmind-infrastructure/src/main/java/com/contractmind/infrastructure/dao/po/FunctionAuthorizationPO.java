package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * agent_function_authorizations 表 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionAuthorizationPO {

    private Long id;
    private String agentId;
    private String functionName;
    private Boolean authorized;
    private LocalDateTime updatedAt;
}
