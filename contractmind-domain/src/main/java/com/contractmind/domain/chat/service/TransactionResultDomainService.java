package com.contractmind.domain.chat.service;

import com.contractmind.domain.chat.adapter.gateway.ITelemetrySink;
import com.contractmind.domain.chat.adapter.repository.ITransactionRecordRepository;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.domain.chat.model.valobj.TransactionOutcomeVO;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.domain.transaction.model.valobj.TransactionReceiptVO;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.TelemetrySchemaEnum;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 交易结果领域服务：用户签名广播后回报 txHash，查询回执并更新交易记录与对话历史。
 */
@Slf4j
@Service
public class TransactionResultDomainService {

    static final String REVERTED_ERROR = "Transaction reverted";
    private static final int DEFAULT_RECEIPT_TIMEOUT_SECONDS = 30;

    private final IBlockchainGateway blockchainGateway;
    private final ITransactionRecordRepository transactionRecordRepository;
    private final ChatHistoryDomainService chatHistoryDomainService;
    private final ITelemetrySink telemetrySink;
    private final ChainSettingsVO chainSettings;

    public TransactionResultDomainService(IBlockchainGateway blockchainGateway,
                                          ITransactionRecordRepository transactionRecordRepository,
                                          ChatHistoryDomainService chatHistoryDomainService,
                                          ITelemetrySink telemetrySink,
                                          ChainSettingsVO chainSettings) {
        this.blockchainGateway = blockchainGateway;
        this.transactionRecordRepository = transactionRecordRepository;
        this.chatHistoryDomainService = chatHistoryDomainService;
        this.telemetrySink = telemetrySink;
        this.chainSettings = chainSettings;
    }

    /**
     * 立即查询回执：未出块记为 pending，已出块按 status 记为 confirmed / failed。
     */
    public TransactionOutcomeVO report(String txHash,
                                       String userAddress,
                                       String agentId,
                                       String functionName,
                                       String targetAddress) {
        requireHash(txHash);
        TransactionReceiptVO receipt = blockchainGateway.getTransactionReceipt(txHash);
        TransactionRecordEntity record = loadOrCreate(txHash, userAddress, agentId, functionName, targetAddress);
        if (receipt == null) {
            String message = pendingMessage(txHash);
            appendAssistant(agentId, userAddress, message, null, false, txHash);
            log.info("TX_RESULT_PENDING txHash={}, agentId={}", txHash, agentId);
            return TransactionOutcomeVO.builder()
                    .status(TransactionOutcomeVO.STATUS_PENDING)
                    .message(message)
                    .txHash(txHash)
                    .build();
        }
        return settle(record, receipt, functionName, agentId, userAddress);
    }

    /**
     * 阻塞等待回执（默认 30 秒），超时仍未出块返回 pending。
     */
    public TransactionOutcomeVO confirm(String txHash, String userAddress, String agentId, String functionName) {
        requireHash(txHash);
        TransactionReceiptVO receipt = blockchainGateway.waitForReceipt(txHash, receiptTimeout());
        if (receipt == null) {
            return TransactionOutcomeVO.builder()
                    .status(TransactionOutcomeVO.STATUS_PENDING)
                    .message("Transaction pending...")
                    .txHash(txHash)
                    .build();
        }
        TransactionRecordEntity record = transactionRecordRepository.findByTxHash(txHash);
        if (record == null) {
            return TransactionOutcomeVO.builder()
                    .status(receipt.isSuccess() ? TransactionOutcomeVO.STATUS_SUCCESS : TransactionOutcomeVO.STATUS_FAILED)
                    .message(receipt.isSuccess() ? "✅ Transaction succeeded" : "❌ Transaction failed")
                    .txHash(txHash)
                    .blockNumber(receipt.getBlockNumber())
                    .gasUsed(receipt.getGasUsed())
                    .build();
        }
        String resolvedFunction = StringUtils.defaultIfBlank(functionName, record.getFunctionName());
        String resolvedUser = StringUtils.defaultIfBlank(userAddress, record.getUserAddress());
        return settle(record, receipt, resolvedFunction, StringUtils.defaultIfBlank(agentId, record.getAgentId()), resolvedUser);
    }

    public List<TransactionRecordEntity> historyByUser(String userAddress, int limit) {
        return transactionRecordRepository.findByUserAddress(ChatHistoryDomainService.normalize(userAddress), limit);
    }

    private TransactionOutcomeVO settle(TransactionRecordEntity record,
                                        TransactionReceiptVO receipt,
                                        String functionName,
                                        String agentId,
                                        String userAddress) {
        if (!record.isFinished()) {
            if (receipt.isSuccess()) {
                record.markConfirmed(receipt.getBlockNumber(), receipt.getGasUsed());
            } else {
                record.markFailed(receipt.getBlockNumber(), receipt.getGasUsed(), REVERTED_ERROR);
            }
            transactionRecordRepository.update(record);
        }
        String message = receipt.isSuccess()
                ? successMessage(functionName, record.getTxHash(), receipt)
                : failureMessage(functionName, record.getTxHash(), receipt);
        appendAssistant(agentId, userAddress, message, functionName, true, record.getTxHash());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("txHash", record.getTxHash());
        event.put("agentId", agentId);
        event.put("status", record.getStatus().getCode());
        event.put("blockNumber", receipt.getBlockNumber());
        event.put("gasUsed", receipt.getGasUsed());
        telemetrySink.publish(TelemetrySchemaEnum.TRANSACTION_EVENT, event);

        log.info("TX_RESULT_SETTLED txHash={}, status={}, block={}, gasUsed={}",
                record.getTxHash(), record.getStatus().getCode(), receipt.getBlockNumber(), receipt.getGasUsed());
        return TransactionOutcomeVO.builder()
                .status(receipt.isSuccess() ? TransactionOutcomeVO.STATUS_SUCCESS : TransactionOutcomeVO.STATUS_FAILED)
                .message(message)
                .txHash(record.getTxHash())
                .blockNumber(receipt.getBlockNumber())
                .gasUsed(receipt.getGasUsed())
                .build();
    }

    private TransactionRecordEntity loadOrCreate(String txHash,
                                                 String userAddress,
                                                 String agentId,
                                                 String functionName,
                                                 String targetAddress) {
        TransactionRecordEntity existing = transactionRecordRepository.findByTxHash(txHash);
        if (existing != null) {
            return existing;
        }
        TransactionRecordEntity record = TransactionRecordEntity.pending(txHash,
                ChatHistoryDomainService.normalize(userAddress), agentId, targetAddress, functionName);
        return transactionRecordRepository.save(record);
    }

    private void appendAssistant(String agentId,
                                 String userAddress,
                                 String message,
                                 String functionName,
                                 boolean requiresTransaction,
                                 String txHash) {
        ChatTurnEntity turn = ChatTurnEntity.assistantTurn(agentId, userAddress, message, functionName, requiresTransaction);
        turn.setTransactionHash(txHash);
        chatHistoryDomainService.append(turn);
    }

    static String pendingMessage(String txHash) {
        return "⏳ Transaction submitted! Hash: `" + txHash + "`\n\nYour transaction is pending confirmation...";
    }

    static String successMessage(String functionName, String txHash, TransactionReceiptVO receipt) {
        return "✅ **Transaction Successful!**\n\n"
                + "**Function:** " + functionName + "\n"
                + "**Transaction Hash:** `" + txHash + "`\n"
                + "**Block:** " + receipt.getBlockNumber() + "\n"
                + "**Gas Used:** " + (receipt.getGasUsed() == null ? "unknown" : String.format(Locale.ROOT, "%,d", receipt.getGasUsed())) + "\n\n"
                + "Your transaction has been confirmed on the blockchain! 🎉";
    }

    static String failureMessage(String functionName, String txHash, TransactionReceiptVO receipt) {
        return "❌ **Transaction Failed**\n\n"
                + "**Function:** " + functionName + "\n"
                + "**Transaction Hash:** `" + txHash + "`\n"
                + "**Block:** " + receipt.getBlockNumber() + "\n\n"
                + "The transaction was reverted. Please check your parameters and try again.";
    }

    private Duration receiptTimeout() {
        Integer seconds = chainSettings == null ? null : chainSettings.getReceiptTimeoutSeconds();
        return Duration.ofSeconds(seconds == null || seconds <= 0 ? DEFAULT_RECEIPT_TIMEOUT_SECONDS : seconds);
    }

    private void requireHash(String txHash) {
        if (StringUtils.isBlank(txHash)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "txHash is required");
        }
    }
}
