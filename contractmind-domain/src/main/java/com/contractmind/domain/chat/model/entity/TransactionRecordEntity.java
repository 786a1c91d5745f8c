package com.contractmind.domain.chat.model.entity;

import com.contractmind.types.enums.TransactionStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * 交易记录实体。
 * <p>
 * 状态只允许 PENDING → CONFIRMED / FAILED，终态后不再变化。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Data
public class TransactionRecordEntity {

    public static final String EXECUTION_MODE_WALLET = "wallet";

    private Long id;

    /**
     * 交易哈希，唯一
     */
    private String txHash;

    private String userAddress;

    private String agentId;

    private String targetAddress;

    private String functionName;

    private String calldata;

    /**
     * 执行方式：wallet（用户钱包直接签名）/ hub / direct
     */
    private String executionMode;

    private TransactionStatusEnum status;

    private Long blockNumber;

    private Long gasUsed;

    private String gasPrice;

    private String intentAction;

    private String intentProtocol;

    private String intentAmount;

    private BigDecimal intentConfidence;

    private String errorMessage;

    private LocalDateTime createdAt;

    private LocalDateTime confirmedAt;

    public static TransactionRecordEntity pending(String txHash,
                                                  String userAddress,
                                                  String agentId,
                                                  String targetAddress,
                                                  String functionName) {
        TransactionRecordEntity record = new TransactionRecordEntity();
        record.setTxHash(txHash);
        record.setUserAddress(userAddress);
        record.setAgentId(agentId);
        record.setTargetAddress(targetAddress);
        record.setFunctionName(functionName);
        record.setCalldata("");
        record.setExecutionMode(EXECUTION_MODE_WALLET);
        record.setStatus(TransactionStatusEnum.PENDING);
        record.setIntentAction(functionName);
        record.setIntentProtocol(agentId);
        record.setIntentConfidence(BigDecimal.ONE);
        return record;
    }

    public boolean isFinished() {
        return status == TransactionStatusEnum.CONFIRMED || status == TransactionStatusEnum.FAILED;
    }

    public void markConfirmed(Long blockNumber, Long gasUsed) {
        ensurePending();
        this.status = TransactionStatusEnum.CONFIRMED;
        this.blockNumber = blockNumber;
        this.gasUsed = gasUsed;
        this.confirmedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public void markFailed(Long blockNumber, Long gasUsed, String errorMessage) {
        ensurePending();
        this.status = TransactionStatusEnum.FAILED;
        this.blockNumber = blockNumber;
        this.gasUsed = gasUsed;
        this.errorMessage = errorMessage;
        this.confirmedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    private void ensurePending() {
        if (isFinished()) {
            throw new IllegalStateException("Transaction " + txHash + " is already " + status.getCode());
        }
    }
}
