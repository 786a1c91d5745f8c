package com.contractmind.domain.analytics.adapter.repository;

import com.contractmind.domain.analytics.model.valobj.AgentUsageVO;
import com.contractmind.domain.analytics.model.valobj.TransactionStatsVO;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交易统计仓储接口
 *
 * @author getoffer
 * @since 2025-10-02
 */
public interface ITransactionAnalyticsRepository {

    /**
     * 聚合交易统计，userAddress / agentId / since 为空时不作为过滤条件
     */
    TransactionStatsVO aggregate(String userAddress, String agentId, LocalDateTime since);

    /**
     * 按 intent_protocol 分组的调用次数，倒序；userAddress 为空时统计全平台
     */
    List<AgentUsageVO> topAgents(String userAddress, int limit);

    long countSince(LocalDateTime since);
}
