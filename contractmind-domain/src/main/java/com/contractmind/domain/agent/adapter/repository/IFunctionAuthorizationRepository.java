package com.contractmind.domain.agent.adapter.repository;

import java.util.Map;

/**
 * 函数授权表仓储接口（agent_function_authorizations）
 */
public interface IFunctionAuthorizationRepository {

    /**
     * 查询 Agent 的授权表：函数名 → 是否授权。未出现的函数视为未授权。
     */
    Map<String, Boolean> findByAgentId(String agentId);

    /**
     * 按 (agentId, functionName) upsert 授权状态
     */
    void upsert(String agentId, String functionName, boolean authorized);

    /**
     * 删除 Agent 的全部授权记录
     */
    int deleteByAgentId(String agentId);
}
