package com.contractmind.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 调用次数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentUsageVO {

    private String name;

    private long count;
}
