package com.contractmind.domain.agent.adapter.repository;

import com.contractmind.domain.agent.model.entity.AgentEntity;

import java.util.List;

/**
 * Agent 缓存仓储接口（agents_cache）
 *
 * @author getoffer
 * @since 2025-10-02
 */
public interface IAgentRepository {

    /**
     * 按 agentId upsert，后写入者覆盖
     */
    AgentEntity save(AgentEntity entity);

    /**
     * 更新 Agent
     */
    AgentEntity update(AgentEntity entity);

    /**
     * 根据 agentId 删除
     */
    boolean deleteByAgentId(String agentId);

    /**
     * 根据 agentId 查询
     */
    AgentEntity findByAgentId(String agentId);

    /**
     * 根据名称查询（忽略大小写）
     */
    AgentEntity findByName(String name);

    /**
     * 查询所有 Agent
     */
    List<AgentEntity> findAll();

    /**
     * 根据激活状态查询
     */
    List<AgentEntity> findByActive(Boolean isActive);
}
