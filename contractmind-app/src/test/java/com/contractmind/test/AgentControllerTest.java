package com.contractmind.test;

import com.contractmind.domain.agent.adapter.gateway.IAgentRegistryGateway;
import com.contractmind.domain.agent.adapter.repository.IAgentRepository;
import com.contractmind.domain.agent.adapter.repository.IFunctionAuthorizationRepository;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.service.AbiFunctionCatalogDomainService;
import com.contractmind.domain.agent.service.AgentDirectoryDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.trigger.application.command.AgentAdminCommandService;
import com.contractmind.trigger.application.query.AgentQueryService;
import com.contractmind.trigger.http.AgentController;
import com.contractmind.trigger.http.GlobalApiExceptionHandler;
import com.contractmind.types.enums.ResponseCode;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AgentControllerTest {

    private MockMvc mockMvc;
    private IAgentRepository agentRepository;
    private IFunctionAuthorizationRepository authorizationRepository;
    private AgentEntity agent;

    @BeforeEach
    public void setUp() {
        agentRepository = mock(IAgentRepository.class);
        authorizationRepository = mock(IFunctionAuthorizationRepository.class);
        AgentDirectoryDomainService directory = new AgentDirectoryDomainService(agentRepository, authorizationRepository,
                mock(IAgentRegistryGateway.class), new AbiFunctionCatalogDomainService(),
                CacheBuilder.newBuilder().maximumSize(10).build());

        agent = ContractFixtures.stakingAgent();
        when(agentRepository.findByAgentId(ContractFixtures.AGENT_ID)).thenReturn(agent);
        when(agentRepository.findByName("DeFi Staking")).thenReturn(agent);
        when(agentRepository.findAll()).thenReturn(List.of(agent));
        when(agentRepository.update(any(AgentEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(authorizationRepository.findByAgentId(ContractFixtures.AGENT_ID)).thenReturn(Map.of("balanceOf", true));

        this.mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(new AgentQueryService(directory),
                        new AgentAdminCommandService(directory)))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldListAgentsWithFunctionCount() throws Exception {
        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data[0].agentId").value(ContractFixtures.AGENT_ID))
                .andExpect(jsonPath("$.data[0].functionCount").value(4))
                .andExpect(jsonPath("$.data[0].active").value(true));
    }

    @Test
    public void shouldReturnDetailWithSelectorsAndAuthorization() throws Exception {
        mockMvc.perform(get("/api/v1/agents/name/DeFi Staking"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.targetAddress").value(ContractFixtures.TARGET))
                .andExpect(jsonPath("$.data.functions[0].name").value("balanceOf"))
                .andExpect(jsonPath("$.data.functions[0].selector").value("0x70a08231"))
                .andExpect(jsonPath("$.data.functions[0].authorized").value(true))
                .andExpect(jsonPath("$.data.functions[2].name").value("stake"))
                .andExpect(jsonPath("$.data.functions[2].authorized").value(false));
    }

    @Test
    public void shouldReturnNotFoundCode() throws Exception {
        mockMvc.perform(get("/api/v1/agents/ghost"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldAuthorizeFunction() throws Exception {
        mockMvc.perform(post("/api/v1/agents/" + ContractFixtures.AGENT_ID + "/authorize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"functionName\":\"stake\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"));
        verify(authorizationRepository).upsert(ContractFixtures.AGENT_ID, "stake", true);
    }

    @Test
    public void shouldRejectRevokeWithoutFunctionName() throws Exception {
        mockMvc.perform(post("/api/v1/agents/" + ContractFixtures.AGENT_ID + "/revoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldDeactivateAgent() throws Exception {
        mockMvc.perform(patch("/api/v1/agents/" + ContractFixtures.AGENT_ID + "/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.active").value(false));
    }

    @Test
    public void shouldDeleteAgent() throws Exception {
        mockMvc.perform(delete("/api/v1/agents/" + ContractFixtures.AGENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
        verify(agentRepository).deleteByAgentId(ContractFixtures.AGENT_ID);
        verify(authorizationRepository).deleteByAgentId(ContractFixtures.AGENT_ID);
    }
}
