package com.contractmind.trigger.application.query;

import com.contractmind.api.dto.ActivityDTO;
import com.contractmind.api.dto.AgentStatsDTO;
import com.contractmind.api.dto.AgentUsageDTO;
import com.contractmind.api.dto.GlobalStatsDTO;
import com.contractmind.api.dto.UserStatsDTO;
import com.contractmind.domain.analytics.model.valobj.ActivityVO;
import com.contractmind.domain.analytics.model.valobj.AgentStatsVO;
import com.contractmind.domain.analytics.model.valobj.AgentUsageVO;
import com.contractmind.domain.analytics.model.valobj.GlobalStatsVO;
import com.contractmind.domain.analytics.model.valobj.UserStatsVO;
import com.contractmind.domain.analytics.service.AnalyticsDomainService;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 交易统计读用例。
 */
@Service
public class AnalyticsQueryService {

    private final AnalyticsDomainService analyticsDomainService;

    public AnalyticsQueryService(AnalyticsDomainService analyticsDomainService) {
        this.analyticsDomainService = analyticsDomainService;
    }

    public UserStatsDTO userStats(String userAddress, Integer days) {
        if (userAddress == null || !userAddress.trim().matches(Constants.ADDRESS_REGEX)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userAddress must be a 0x-prefixed 40 hex address");
        }
        UserStatsVO stats = analyticsDomainService.userStats(userAddress, resolveDays(days));
        UserStatsDTO dto = new UserStatsDTO();
        dto.setUserAddress(stats.getUserAddress());
        dto.setTotalTransactions(stats.getTotalTransactions());
        dto.setTotalGasUsed(stats.getTotalGasUsed());
        dto.setSuccessRate(stats.getSuccessRate());
        dto.setFavoriteAgents(toUsage(stats.getFavoriteAgents()));
        dto.setRecentActivity(stats.getRecentActivity() == null ? Collections.emptyList()
                : stats.getRecentActivity().stream().map(AnalyticsQueryService::toActivity).collect(Collectors.toList()));
        return dto;
    }

    public AgentStatsDTO agentStats(String agentId, Integer days) {
        AgentStatsVO stats = analyticsDomainService.agentStats(agentId, resolveDays(days));
        AgentStatsDTO dto = new AgentStatsDTO();
        dto.setAgentId(stats.getAgentId());
        dto.setAgentName(stats.getAgentName());
        dto.setTotalCalls(stats.getTotalCalls());
        dto.setUniqueUsers(stats.getUniqueUsers());
        dto.setTotalGasUsed(stats.getTotalGasUsed());
        dto.setSuccessRate(stats.getSuccessRate());
        dto.setAverageGasPerCall(stats.getAverageGasPerCall());
        return dto;
    }

    public GlobalStatsDTO globalStats(Integer days) {
        GlobalStatsVO stats = analyticsDomainService.globalStats(resolveDays(days));
        GlobalStatsDTO dto = new GlobalStatsDTO();
        dto.setTotalTransactions(stats.getTotalTransactions());
        dto.setTotalUsers(stats.getTotalUsers());
        dto.setTotalAgents(stats.getTotalAgents());
        dto.setTotalGasUsed(stats.getTotalGasUsed());
        dto.setSuccessRate(stats.getSuccessRate());
        dto.setTransactionsLast24h(stats.getTransactionsLast24h());
        dto.setTopAgents(toUsage(stats.getTopAgents()));
        return dto;
    }

    private int resolveDays(Integer days) {
        return days == null ? AnalyticsDomainService.DEFAULT_WINDOW_DAYS : days;
    }

    private static List<AgentUsageDTO> toUsage(List<AgentUsageVO> usages) {
        if (usages == null) {
            return Collections.emptyList();
        }
        return usages.stream().map(usage -> {
            AgentUsageDTO dto = new AgentUsageDTO();
            dto.setName(usage.getName());
            dto.setCount(usage.getCount());
            return dto;
        }).collect(Collectors.toList());
    }

    private static ActivityDTO toActivity(ActivityVO activity) {
        ActivityDTO dto = new ActivityDTO();
        dto.setAction(activity.getAction());
        dto.setProtocol(activity.getProtocol());
        dto.setTimestamp(activity.getTimestamp());
        dto.setSuccess(activity.isSuccess());
        return dto;
    }
}
