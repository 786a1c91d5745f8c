package com.contractmind.domain.agent.service;

import com.contractmind.domain.agent.adapter.gateway.IAgentRegistryGateway;
import com.contractmind.domain.agent.adapter.repository.IAgentRepository;
import com.contractmind.domain.agent.adapter.repository.IFunctionAuthorizationRepository;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Agent 目录领域服务。
 * <p>
 * 查询顺序：
 * <ul>
 *   <li>agents_cache 按 agentId 命中</li>
 *   <li>agents_cache 按名称命中</li>
 *   <li>链上注册表 getAgent(bytes32)，命中后写回缓存表</li>
 * </ul>
 * 解析后的函数目录放在本地 Guava 缓存中，ABI 或授权变化时失效。
 * </p>
 */
@Slf4j
@Service
public class AgentDirectoryDomainService {

    private final IAgentRepository agentRepository;
    private final IFunctionAuthorizationRepository functionAuthorizationRepository;
    private final IAgentRegistryGateway agentRegistryGateway;
    private final AbiFunctionCatalogDomainService catalogDomainService;
    private final Cache<String, FunctionCatalogVO> functionCatalogCache;

    public AgentDirectoryDomainService(IAgentRepository agentRepository,
                                       IFunctionAuthorizationRepository functionAuthorizationRepository,
                                       IAgentRegistryGateway agentRegistryGateway,
                                       AbiFunctionCatalogDomainService catalogDomainService,
                                       Cache<String, FunctionCatalogVO> functionCatalogCache) {
        this.agentRepository = agentRepository;
        this.functionAuthorizationRepository = functionAuthorizationRepository;
        this.agentRegistryGateway = agentRegistryGateway;
        this.catalogDomainService = catalogDomainService;
        this.functionCatalogCache = functionCatalogCache;
    }

    /**
     * 按 agentId 或名称解析 Agent，未找到返回 null。
     */
    public AgentEntity resolveAgent(String agentIdOrName) {
        if (StringUtils.isBlank(agentIdOrName)) {
            return null;
        }
        String key = agentIdOrName.trim();
        AgentEntity cached = agentRepository.findByAgentId(key);
        if (cached != null) {
            return cached;
        }
        AgentEntity byName = agentRepository.findByName(key);
        if (byName != null) {
            return byName;
        }
        AgentEntity onChain;
        try {
            onChain = agentRegistryGateway.fetchAgent(key);
        } catch (Exception ex) {
            log.warn("AGENT_REGISTRY_READ_FAILED agentId={}, error={}", key, ex.getMessage());
            return null;
        }
        if (onChain == null) {
            return null;
        }
        try {
            onChain.validate();
            AgentEntity saved = agentRepository.save(onChain);
            log.info("AGENT_MIRRORED agentId={}, target={}", saved.getAgentId(), saved.getTargetAddress());
            return saved;
        } catch (Exception ex) {
            log.warn("AGENT_MIRROR_FAILED agentId={}, error={}", key, ex.getMessage());
            return onChain;
        }
    }

    /**
     * 解析 Agent，未找到抛出 NOT_FOUND。
     */
    public AgentEntity requireAgent(String agentIdOrName) {
        AgentEntity agent = resolveAgent(agentIdOrName);
        if (agent == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Agent not found: " + agentIdOrName);
        }
        return agent;
    }

    /**
     * 加载 Agent 函数目录（带授权位），按 agentId 缓存。
     */
    public FunctionCatalogVO loadCatalog(AgentEntity agent) {
        if (agent == null || !agent.hasAbi()) {
            return FunctionCatalogVO.empty();
        }
        FunctionCatalogVO cached = functionCatalogCache.getIfPresent(agent.getAgentId());
        if (cached != null) {
            return cached;
        }
        Map<String, Boolean> authorizations = functionAuthorizationRepository.findByAgentId(agent.getAgentId());
        FunctionCatalogVO catalog = catalogDomainService.parse(agent.getAbi(), authorizations);
        functionCatalogCache.put(agent.getAgentId(), catalog);
        return catalog;
    }

    public List<AgentEntity> listAgents(Boolean active) {
        return active == null ? agentRepository.findAll() : agentRepository.findByActive(active);
    }

    /**
     * 修改函数授权位。
     */
    public void changeAuthorization(String agentId, String functionName, boolean authorized) {
        if (StringUtils.isBlank(functionName)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "functionName is required");
        }
        AgentEntity agent = requireAgent(agentId);
        functionAuthorizationRepository.upsert(agent.getAgentId(), functionName.trim(), authorized);
        functionCatalogCache.invalidate(agent.getAgentId());
        log.info("FUNCTION_AUTHORIZATION_CHANGED agentId={}, functionName={}, authorized={}",
                agent.getAgentId(), functionName, authorized);
    }

    public AgentEntity changeStatus(String agentId, boolean active) {
        AgentEntity agent = requireAgent(agentId);
        if (active) {
            agent.activate();
        } else {
            agent.deactivate();
        }
        return agentRepository.update(agent);
    }

    public AgentEntity updateMetadata(String agentId, String name, String description, List<Map<String, Object>> abi) {
        AgentEntity agent = requireAgent(agentId);
        agent.updateMetadata(name, description, abi);
        AgentEntity updated = agentRepository.update(agent);
        functionCatalogCache.invalidate(agent.getAgentId());
        return updated;
    }

    /**
     * 管理员硬删除：同时清理授权表。
     */
    public void deleteAgent(String agentId) {
        AgentEntity agent = requireAgent(agentId);
        functionAuthorizationRepository.deleteByAgentId(agent.getAgentId());
        agentRepository.deleteByAgentId(agent.getAgentId());
        functionCatalogCache.invalidate(agent.getAgentId());
        log.info("AGENT_DELETED agentId={}, at={}", agent.getAgentId(), LocalDateTime.now());
    }
}
