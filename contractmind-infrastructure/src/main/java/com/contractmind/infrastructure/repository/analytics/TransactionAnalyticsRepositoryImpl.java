package com.contractmind.infrastructure.repository.analytics;

import com.contractmind.domain.analytics.adapter.repository.ITransactionAnalyticsRepository;
import com.contractmind.domain.analytics.model.valobj.AgentUsageVO;
import com.contractmind.domain.analytics.model.valobj.TransactionStatsVO;
import com.contractmind.infrastructure.dao.TransactionDao;
import com.contractmind.infrastructure.dao.po.AgentUsagePO;
import com.contractmind.infrastructure.dao.po.TransactionStatsPO;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 交易统计仓储实现，聚合在 SQL 中完成。
 */
@Repository
public class TransactionAnalyticsRepositoryImpl implements ITransactionAnalyticsRepository {

    private final TransactionDao transactionDao;

    public TransactionAnalyticsRepositoryImpl(TransactionDao transactionDao) {
        this.transactionDao = transactionDao;
    }

    @Override
    public TransactionStatsVO aggregate(String userAddress, String agentId, LocalDateTime since) {
        TransactionStatsPO po = transactionDao.selectStats(userAddress, agentId, since);
        if (po == null) {
            return TransactionStatsVO.empty();
        }
        return TransactionStatsVO.builder()
                .totalTransactions(orZero(po.getTotalTransactions()))
                .successfulTransactions(orZero(po.getSuccessfulTransactions()))
                .uniqueUsers(orZero(po.getUniqueUsers()))
                .totalGasUsed(orZero(po.getTotalGasUsed()))
                .averageGasUsed(po.getAverageGasUsed() == null ? 0L : po.getAverageGasUsed().longValue())
                .successRate(po.getSuccessRate() == null ? 0D : po.getSuccessRate().doubleValue())
                .build();
    }

    @Override
    public List<AgentUsageVO> topAgents(String userAddress, int limit) {
        List<AgentUsagePO> rows = transactionDao.selectTopProtocols(userAddress, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream()
                .map(row -> new AgentUsageVO(row.getName(), orZero(row.getUsageCount())))
                .collect(Collectors.toList());
    }

    @Override
    public long countSince(LocalDateTime since) {
        return transactionDao.countSince(since);
    }

    private long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
