package com.contractmind.trigger.application.common;

import com.contractmind.api.dto.AbiFunctionDTO;
import com.contractmind.api.dto.AbiParameterDTO;
import com.contractmind.api.dto.AgentDetailDTO;
import com.contractmind.api.dto.AgentSummaryDTO;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 视图组装。
 */
public final class AgentViewAssembler {

    private AgentViewAssembler() {
    }

    public static AgentSummaryDTO toSummary(AgentEntity agent, FunctionCatalogVO catalog) {
        AgentSummaryDTO dto = new AgentSummaryDTO();
        fillSummary(dto, agent, catalog);
        return dto;
    }

    public static AgentDetailDTO toDetail(AgentEntity agent, FunctionCatalogVO catalog) {
        AgentDetailDTO dto = new AgentDetailDTO();
        fillSummary(dto, agent, catalog);
        dto.setConfigIpfs(agent.getConfigIpfs());
        dto.setFunctions(catalog.getFunctions().stream()
                .map(AgentViewAssembler::toFunction)
                .collect(Collectors.toList()));
        return dto;
    }

    private static void fillSummary(AgentSummaryDTO dto, AgentEntity agent, FunctionCatalogVO catalog) {
        dto.setAgentId(agent.getAgentId());
        dto.setName(agent.getName());
        dto.setDescription(agent.getDescription());
        dto.setOwner(agent.getOwner());
        dto.setTargetAddress(agent.getTargetAddress());
        dto.setActive(agent.isActiveAgent());
        dto.setFunctionCount(catalog.size());
        dto.setCreatedAt(agent.getCreatedAt());
        dto.setUpdatedAt(agent.getUpdatedAt());
    }

    private static AbiFunctionDTO toFunction(FunctionDescriptorVO function) {
        AbiFunctionDTO dto = new AbiFunctionDTO();
        dto.setName(function.getName());
        dto.setSignature(function.getSignature());
        dto.setSelector(CalldataEncoderDomainService.selectorOf(function.getSignature()));
        dto.setInputs(toParameters(function.safeInputs()));
        dto.setOutputs(toParameters(function.safeOutputs()));
        dto.setStateMutability(function.getStateMutability() == null ? null : function.getStateMutability().getCode());
        dto.setAuthorized(function.isAuthorized());
        return dto;
    }

    private static List<AbiParameterDTO> toParameters(List<AbiParameterVO> parameters) {
        return parameters.stream().map(parameter -> {
            AbiParameterDTO dto = new AbiParameterDTO();
            dto.setName(parameter.getName());
            dto.setType(parameter.getType());
            return dto;
        }).collect(Collectors.toList());
    }
}
