package com.contractmind.trigger.application.command;

import com.contractmind.api.dto.AgentDetailDTO;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.service.AgentDirectoryDomainService;
import com.contractmind.trigger.application.common.AgentViewAssembler;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Agent 管理写用例：授权、启停、元数据修改与删除。
 */
@Slf4j
@Service
public class AgentAdminCommandService {

    private final AgentDirectoryDomainService agentDirectoryDomainService;

    public AgentAdminCommandService(AgentDirectoryDomainService agentDirectoryDomainService) {
        this.agentDirectoryDomainService = agentDirectoryDomainService;
    }

    public AgentDetailDTO authorize(String agentId, String functionName) {
        agentDirectoryDomainService.changeAuthorization(agentId, functionName, true);
        return reload(agentId);
    }

    public AgentDetailDTO revoke(String agentId, String functionName) {
        agentDirectoryDomainService.changeAuthorization(agentId, functionName, false);
        return reload(agentId);
    }

    public AgentDetailDTO changeStatus(String agentId, Boolean active) {
        if (active == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "active is required");
        }
        AgentEntity agent = agentDirectoryDomainService.changeStatus(agentId, active);
        log.info("AGENT_STATUS_CHANGED agentId={}, active={}", agent.getAgentId(), active);
        return AgentViewAssembler.toDetail(agent, agentDirectoryDomainService.loadCatalog(agent));
    }

    public AgentDetailDTO update(String agentId, String name, String description, List<Map<String, Object>> abi) {
        AgentEntity agent = agentDirectoryDomainService.updateMetadata(agentId, name, description, abi);
        log.info("AGENT_UPDATED agentId={}, abiReplaced={}", agent.getAgentId(), abi != null);
        return AgentViewAssembler.toDetail(agent, agentDirectoryDomainService.loadCatalog(agent));
    }

    public void delete(String agentId) {
        agentDirectoryDomainService.deleteAgent(agentId);
    }

    private AgentDetailDTO reload(String agentId) {
        AgentEntity agent = agentDirectoryDomainService.requireAgent(agentId);
        return AgentViewAssembler.toDetail(agent, agentDirectoryDomainService.loadCatalog(agent));
    }
}
