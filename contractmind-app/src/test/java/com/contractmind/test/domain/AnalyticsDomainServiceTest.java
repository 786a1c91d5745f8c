package com.contractmind.test.domain;

import com.contractmind.domain.agent.adapter.repository.IAgentRepository;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.analytics.adapter.repository.ITransactionAnalyticsRepository;
import com.contractmind.domain.analytics.model.valobj.AgentStatsVO;
import com.contractmind.domain.analytics.model.valobj.AgentUsageVO;
import com.contractmind.domain.analytics.model.valobj.GlobalStatsVO;
import com.contractmind.domain.analytics.model.valobj.TransactionStatsVO;
import com.contractmind.domain.analytics.model.valobj.UserStatsVO;
import com.contractmind.domain.analytics.service.AnalyticsDomainService;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.test.support.InMemoryTransactionRecordRepository;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.TransactionStatusEnum;
import com.contractmind.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AnalyticsDomainServiceTest {

    private ITransactionAnalyticsRepository analyticsRepository;
    private InMemoryTransactionRecordRepository transactionRepository;
    private IAgentRepository agentRepository;
    private AnalyticsDomainService service;

    @BeforeEach
    public void setUp() {
        analyticsRepository = mock(ITransactionAnalyticsRepository.class);
        transactionRepository = new InMemoryTransactionRecordRepository();
        agentRepository = mock(IAgentRepository.class);
        service = new AnalyticsDomainService(analyticsRepository, transactionRepository, agentRepository);
    }

    @Test
    public void shouldAggregateUserStatsWithinWindow() {
        TransactionRecordEntity confirmed = TransactionRecordEntity.pending("0x01", ContractFixtures.USER,
                ContractFixtures.AGENT_ID, ContractFixtures.TARGET, "stake");
        confirmed.setStatus(TransactionStatusEnum.CONFIRMED);
        transactionRepository.save(confirmed);
        when(analyticsRepository.aggregate(eq(ContractFixtures.USER), isNull(), any(LocalDateTime.class)))
                .thenReturn(TransactionStatsVO.builder().totalTransactions(4).totalGasUsed(84000).successRate(0.75).build());
        when(analyticsRepository.topAgents(ContractFixtures.USER, 5))
                .thenReturn(Collections.singletonList(new AgentUsageVO(ContractFixtures.AGENT_ID, 4)));

        UserStatsVO stats = service.userStats(ContractFixtures.USER.toUpperCase().replace("0X", "0x"), 30);

        ArgumentCaptor<LocalDateTime> since = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(analyticsRepository).aggregate(eq(ContractFixtures.USER), isNull(), since.capture());
        long days = Duration.between(since.getValue(), LocalDateTime.now(ZoneOffset.UTC)).toDays();
        Assertions.assertEquals(30, days);
        Assertions.assertEquals(ContractFixtures.USER, stats.getUserAddress());
        Assertions.assertEquals(4, stats.getTotalTransactions());
        Assertions.assertEquals(84000, stats.getTotalGasUsed());
        Assertions.assertEquals(0.75, stats.getSuccessRate());
        Assertions.assertEquals(ContractFixtures.AGENT_ID, stats.getFavoriteAgents().get(0).getName());
        Assertions.assertEquals(1, stats.getRecentActivity().size());
        Assertions.assertEquals("stake", stats.getRecentActivity().get(0).getAction());
        Assertions.assertEquals(ContractFixtures.AGENT_ID, stats.getRecentActivity().get(0).getProtocol());
        Assertions.assertTrue(stats.getRecentActivity().get(0).isSuccess());
    }

    @Test
    public void shouldReturnZeroStatsWhenNothingRecorded() {
        UserStatsVO stats = service.userStats(ContractFixtures.USER, 7);

        Assertions.assertEquals(0, stats.getTotalTransactions());
        Assertions.assertEquals(0.0, stats.getSuccessRate());
        Assertions.assertTrue(stats.getRecentActivity().isEmpty());
    }

    @Test
    public void shouldFallBackToUnknownAgentName() {
        when(analyticsRepository.aggregate(isNull(), eq("missing"), any(LocalDateTime.class)))
                .thenReturn(TransactionStatsVO.builder().totalTransactions(2).uniqueUsers(1).averageGasUsed(21000).build());

        AgentStatsVO stats = service.agentStats("missing", 7);

        Assertions.assertEquals("Unknown Agent", stats.getAgentName());
        Assertions.assertEquals(2, stats.getTotalCalls());
        Assertions.assertEquals(1, stats.getUniqueUsers());
        Assertions.assertEquals(21000, stats.getAverageGasPerCall());
    }

    @Test
    public void shouldUseRegisteredAgentName() {
        AgentEntity agent = new AgentEntity();
        agent.setAgentId(ContractFixtures.AGENT_ID);
        agent.setName("DeFi Staking");
        when(agentRepository.findByAgentId(ContractFixtures.AGENT_ID)).thenReturn(agent);

        AgentStatsVO stats = service.agentStats(ContractFixtures.AGENT_ID, 7);

        Assertions.assertEquals("DeFi Staking", stats.getAgentName());
    }

    @Test
    public void shouldCountActiveAgentsAndRecentTransactionsGlobally() {
        when(agentRepository.findByActive(Boolean.TRUE)).thenReturn(Arrays.asList(new AgentEntity(), new AgentEntity()));
        when(analyticsRepository.countSince(any(LocalDateTime.class))).thenReturn(3L);
        when(analyticsRepository.topAgents(isNull(), anyInt()))
                .thenReturn(Collections.singletonList(new AgentUsageVO(ContractFixtures.AGENT_ID, 9)));

        GlobalStatsVO stats = service.globalStats(7);

        Assertions.assertEquals(2, stats.getTotalAgents());
        Assertions.assertEquals(3, stats.getTransactionsLast24h());
        Assertions.assertEquals(9, stats.getTopAgents().get(0).getCount());
        verify(analyticsRepository).topAgents(null, 10);
    }

    @Test
    public void shouldRejectNonPositiveWindow() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.globalStats(0));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }
}
