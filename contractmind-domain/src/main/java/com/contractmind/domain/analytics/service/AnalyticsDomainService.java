package com.contractmind.domain.analytics.service;

import com.contractmind.domain.agent.adapter.repository.IAgentRepository;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.analytics.adapter.repository.ITransactionAnalyticsRepository;
import com.contractmind.domain.analytics.model.valobj.ActivityVO;
import com.contractmind.domain.analytics.model.valobj.AgentStatsVO;
import com.contractmind.domain.analytics.model.valobj.GlobalStatsVO;
import com.contractmind.domain.analytics.model.valobj.TransactionStatsVO;
import com.contractmind.domain.analytics.model.valobj.UserStatsVO;
import com.contractmind.domain.chat.adapter.repository.ITransactionRecordRepository;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.TransactionStatusEnum;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 交易统计领域服务。
 * <p>
 * 时间窗口按天计算，起点为当前 UTC 时间减去 days 天。
 * </p>
 */
@Slf4j
@Service
public class AnalyticsDomainService {

    public static final int DEFAULT_WINDOW_DAYS = 7;

    private static final int FAVORITE_AGENT_LIMIT = 5;
    private static final int RECENT_ACTIVITY_LIMIT = 10;
    private static final int TOP_AGENT_LIMIT = 10;
    private static final String UNKNOWN = "unknown";
    private static final String UNKNOWN_AGENT = "Unknown Agent";

    private final ITransactionAnalyticsRepository analyticsRepository;
    private final ITransactionRecordRepository transactionRecordRepository;
    private final IAgentRepository agentRepository;

    public AnalyticsDomainService(ITransactionAnalyticsRepository analyticsRepository,
                                  ITransactionRecordRepository transactionRecordRepository,
                                  IAgentRepository agentRepository) {
        this.analyticsRepository = analyticsRepository;
        this.transactionRecordRepository = transactionRecordRepository;
        this.agentRepository = agentRepository;
    }

    public UserStatsVO userStats(String userAddress, int days) {
        if (StringUtils.isBlank(userAddress)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userAddress is required");
        }
        String user = userAddress.trim().toLowerCase(Locale.ROOT);
        TransactionStatsVO stats = aggregate(user, null, windowStart(days));
        List<ActivityVO> recent = transactionRecordRepository.findByUserAddress(user, RECENT_ACTIVITY_LIMIT).stream()
                .map(this::toActivity)
                .collect(Collectors.toList());
        log.info("ANALYTICS_USER user={}, days={}, total={}", user, days, stats.getTotalTransactions());
        return UserStatsVO.builder()
                .userAddress(user)
                .totalTransactions(stats.getTotalTransactions())
                .totalGasUsed(stats.getTotalGasUsed())
                .successRate(stats.getSuccessRate())
                .favoriteAgents(analyticsRepository.topAgents(user, FAVORITE_AGENT_LIMIT))
                .recentActivity(recent)
                .build();
    }

    public AgentStatsVO agentStats(String agentId, int days) {
        if (StringUtils.isBlank(agentId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "agentId is required");
        }
        String id = agentId.trim();
        TransactionStatsVO stats = aggregate(null, id, windowStart(days));
        AgentEntity agent = agentRepository.findByAgentId(id);
        log.info("ANALYTICS_AGENT agentId={}, days={}, total={}", id, days, stats.getTotalTransactions());
        return AgentStatsVO.builder()
                .agentId(id)
                .agentName(agent == null || StringUtils.isBlank(agent.getName()) ? UNKNOWN_AGENT : agent.getName())
                .totalCalls(stats.getTotalTransactions())
                .uniqueUsers(stats.getUniqueUsers())
                .totalGasUsed(stats.getTotalGasUsed())
                .successRate(stats.getSuccessRate())
                .averageGasPerCall(stats.getAverageGasUsed())
                .build();
    }

    public GlobalStatsVO globalStats(int days) {
        TransactionStatsVO stats = aggregate(null, null, windowStart(days));
        long activeAgents = agentRepository.findByActive(Boolean.TRUE).size();
        long last24h = analyticsRepository.countSince(LocalDateTime.now(ZoneOffset.UTC).minusHours(24));
        log.info("ANALYTICS_GLOBAL days={}, total={}, agents={}", days, stats.getTotalTransactions(), activeAgents);
        return GlobalStatsVO.builder()
                .totalTransactions(stats.getTotalTransactions())
                .totalUsers(stats.getUniqueUsers())
                .totalAgents(activeAgents)
                .totalGasUsed(stats.getTotalGasUsed())
                .successRate(stats.getSuccessRate())
                .transactionsLast24h(last24h)
                .topAgents(analyticsRepository.topAgents(null, TOP_AGENT_LIMIT))
                .build();
    }

    private TransactionStatsVO aggregate(String userAddress, String agentId, LocalDateTime since) {
        TransactionStatsVO stats = analyticsRepository.aggregate(userAddress, agentId, since);
        return stats == null ? TransactionStatsVO.empty() : stats;
    }

    private LocalDateTime windowStart(int days) {
        if (days < 1) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "days must be at least 1");
        }
        return LocalDateTime.now(ZoneOffset.UTC).minusDays(days);
    }

    private ActivityVO toActivity(TransactionRecordEntity record) {
        return ActivityVO.builder()
                .action(StringUtils.defaultIfBlank(record.getIntentAction(), UNKNOWN))
                .protocol(StringUtils.defaultIfBlank(record.getIntentProtocol(), UNKNOWN))
                .timestamp(record.getCreatedAt())
                .success(record.getStatus() == TransactionStatusEnum.CONFIRMED)
                .build();
    }
}
