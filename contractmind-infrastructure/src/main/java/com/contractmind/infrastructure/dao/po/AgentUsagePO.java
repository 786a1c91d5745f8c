package com.contractmind.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按 intent_protocol 分组计数结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentUsagePO {

    private String name;
    private Long usageCount;
}
