package com.contractmind.test.support;

import com.contractmind.domain.chat.adapter.repository.ITransactionRecordRepository;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存交易记录仓储，按 txHash 去重。
 */
public class InMemoryTransactionRecordRepository implements ITransactionRecordRepository {

    private final Map<String, TransactionRecordEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private int updateCount;

    @Override
    public TransactionRecordEntity save(TransactionRecordEntity record) {
        TransactionRecordEntity existing = store.get(record.getTxHash());
        record.setId(existing == null ? Long.valueOf(nextId++) : existing.getId());
        store.put(record.getTxHash(), record);
        return record;
    }

    @Override
    public TransactionRecordEntity update(TransactionRecordEntity record) {
        updateCount++;
        store.put(record.getTxHash(), record);
        return record;
    }

    @Override
    public TransactionRecordEntity findByTxHash(String txHash) {
        return store.get(txHash);
    }

    @Override
    public List<TransactionRecordEntity> findByUserAddress(String userAddress, int limit) {
        return store.values().stream()
                .filter(item -> Objects.equals(userAddress, item.getUserAddress()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<TransactionRecordEntity> findByAgentId(String agentId, int limit) {
        return store.values().stream()
                .filter(item -> Objects.equals(agentId, item.getAgentId()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public int getUpdateCount() {
        return updateCount;
    }

    public List<TransactionRecordEntity> all() {
        return new ArrayList<>(store.values());
    }
}
