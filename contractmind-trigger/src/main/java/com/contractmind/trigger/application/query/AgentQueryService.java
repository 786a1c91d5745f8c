package com.contractmind.trigger.application.query;

import com.contractmind.api.dto.AgentDetailDTO;
import com.contractmind.api.dto.AgentSummaryDTO;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.service.AgentDirectoryDomainService;
import com.contractmind.trigger.application.common.AgentViewAssembler;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 目录读用例。
 */
@Service
public class AgentQueryService {

    private final AgentDirectoryDomainService agentDirectoryDomainService;

    public AgentQueryService(AgentDirectoryDomainService agentDirectoryDomainService) {
        this.agentDirectoryDomainService = agentDirectoryDomainService;
    }

    public List<AgentSummaryDTO> list(Boolean active) {
        return agentDirectoryDomainService.listAgents(active).stream()
                .map(agent -> AgentViewAssembler.toSummary(agent, agentDirectoryDomainService.loadCatalog(agent)))
                .collect(Collectors.toList());
    }

    /**
     * 按 agentId 或名称查询详情，不存在时抛出 NOT_FOUND。
     */
    public AgentDetailDTO detail(String agentIdOrName) {
        AgentEntity agent = agentDirectoryDomainService.requireAgent(agentIdOrName);
        return AgentViewAssembler.toDetail(agent, agentDirectoryDomainService.loadCatalog(agent));
    }
}
