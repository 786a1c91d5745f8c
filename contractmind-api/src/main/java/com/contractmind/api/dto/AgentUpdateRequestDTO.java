package com.contractmind.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Agent 元数据更新请求，字段为空表示不修改。
 */
@Data
public class AgentUpdateRequestDTO {

    private String name;
    private String description;
    private List<Map<String, Object>> abi;
}
