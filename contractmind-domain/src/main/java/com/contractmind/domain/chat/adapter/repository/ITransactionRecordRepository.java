package com.contractmind.domain.chat.adapter.repository;

import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;

import java.util.List;

/**
 * 交易记录仓储接口
 *
 * @author getoffer
 * @since 2025-10-02
 */
public interface ITransactionRecordRepository {

    /**
     * 按 txHash 插入或更新
     */
    TransactionRecordEntity save(TransactionRecordEntity record);

    TransactionRecordEntity update(TransactionRecordEntity record);

    TransactionRecordEntity findByTxHash(String txHash);

    /**
     * 用户交易历史，按创建时间倒序
     */
    List<TransactionRecordEntity> findByUserAddress(String userAddress, int limit);

    List<TransactionRecordEntity> findByAgentId(String agentId, int limit);
}
