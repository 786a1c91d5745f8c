package com.contractmind.infrastructure.repository.chat;

import com.contractmind.domain.chat.adapter.repository.ITransactionRecordRepository;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.infrastructure.dao.TransactionDao;
import com.contractmind.infrastructure.dao.po.TransactionPO;
import com.contractmind.types.enums.TransactionStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 交易记录仓储实现。
 */
@Slf4j
@Repository
public class TransactionRecordRepositoryImpl implements ITransactionRecordRepository {

    private final TransactionDao transactionDao;

    public TransactionRecordRepositoryImpl(TransactionDao transactionDao) {
        this.transactionDao = transactionDao;
    }

    @Override
    public TransactionRecordEntity save(TransactionRecordEntity record) {
        try {
            transactionDao.insert(toPO(record));
        } catch (DuplicateKeyException ex) {
            log.info("TX_RECORD_EXISTS txHash={}, updating instead", record.getTxHash());
            transactionDao.updateStatus(toPO(record));
        }
        return findByTxHash(record.getTxHash());
    }

    @Override
    public TransactionRecordEntity update(TransactionRecordEntity record) {
        transactionDao.updateStatus(toPO(record));
        return findByTxHash(record.getTxHash());
    }

    @Override
    public TransactionRecordEntity findByTxHash(String txHash) {
        return toEntity(transactionDao.selectByTxHash(txHash));
    }

    @Override
    public List<TransactionRecordEntity> findByUserAddress(String userAddress, int limit) {
        return toEntities(transactionDao.selectByUserAddress(userAddress, limit));
    }

    @Override
    public List<TransactionRecordEntity> findByAgentId(String agentId, int limit) {
        return toEntities(transactionDao.selectByAgentId(agentId, limit));
    }

    private List<TransactionRecordEntity> toEntities(List<TransactionPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TransactionRecordEntity toEntity(TransactionPO po) {
        if (po == null) {
            return null;
        }
        TransactionRecordEntity entity = new TransactionRecordEntity();
        entity.setId(po.getId());
        entity.setTxHash(po.getTxHash());
        entity.setUserAddress(po.getUserAddress());
        entity.setAgentId(po.getAgentId());
        entity.setTargetAddress(po.getTargetAddress());
        entity.setFunctionName(po.getFunctionName());
        entity.setCalldata(po.getCalldata());
        entity.setExecutionMode(po.getExecutionMode());
        entity.setStatus(TransactionStatusEnum.fromCode(po.getStatus()));
        entity.setBlockNumber(po.getBlockNumber());
        entity.setGasUsed(po.getGasUsed());
        entity.setGasPrice(po.getGasPrice());
        entity.setIntentAction(po.getIntentAction());
        entity.setIntentProtocol(po.getIntentProtocol());
        entity.setIntentAmount(po.getIntentAmount());
        entity.setIntentConfidence(po.getIntentConfidence());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setConfirmedAt(po.getConfirmedAt());
        return entity;
    }

    private TransactionPO toPO(TransactionRecordEntity entity) {
        return TransactionPO.builder()
                .id(entity.getId())
                .txHash(entity.getTxHash())
                .userAddress(entity.getUserAddress())
                .agentId(entity.getAgentId())
                .targetAddress(entity.getTargetAddress())
                .functionName(entity.getFunctionName())
                .calldata(entity.getCalldata())
                .executionMode(entity.getExecutionMode())
                .status(entity.getStatus() == null ? TransactionStatusEnum.PENDING.getCode() : entity.getStatus().getCode())
                .blockNumber(entity.getBlockNumber())
                .gasUsed(entity.getGasUsed())
                .gasPrice(entity.getGasPrice())
                .intentAction(entity.getIntentAction())
                .intentProtocol(entity.getIntentProtocol())
                .intentAmount(entity.getIntentAmount())
                .intentConfidence(entity.getIntentConfidence())
                .errorMessage(entity.getErrorMessage())
                .confirmedAt(entity.getConfirmedAt())
                .build();
    }
}
