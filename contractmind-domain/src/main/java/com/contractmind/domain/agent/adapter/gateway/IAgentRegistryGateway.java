package com.contractmind.domain.agent.adapter.gateway;

import com.contractmind.domain.agent.model.entity.AgentEntity;

/**
 * 链上 Agent 注册表读取端口。
 */
public interface IAgentRegistryGateway {

    /**
     * 调用注册表合约 {@code getAgent(bytes32)}。
     *
     * @param agentId Agent 标识
     * @return 注册表中的 Agent；未注册（owner 为零地址）时返回 null
     */
    AgentEntity fetchAgent(String agentId);
}
