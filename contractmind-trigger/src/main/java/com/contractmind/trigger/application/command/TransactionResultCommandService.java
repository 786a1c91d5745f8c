package com.contractmind.trigger.application.command;

import com.contractmind.api.dto.ChatSocketEventDTO;
import com.contractmind.api.dto.TransactionResultResponseDTO;
import com.contractmind.domain.chat.model.valobj.TransactionOutcomeVO;
import com.contractmind.domain.chat.service.TransactionResultDomainService;
import com.contractmind.trigger.websocket.WebSocketSessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 交易结果写用例：落库、写对话历史，并通过 WebSocket 通知该用户的其它连接。
 */
@Slf4j
@Service
public class TransactionResultCommandService {

    public static final String EVENT_TRANSACTION_RESULT = "transaction_result";

    private final TransactionResultDomainService transactionResultDomainService;
    private final WebSocketSessionRegistry webSocketSessionRegistry;

    public TransactionResultCommandService(TransactionResultDomainService transactionResultDomainService,
                                           WebSocketSessionRegistry webSocketSessionRegistry) {
        this.transactionResultDomainService = transactionResultDomainService;
        this.webSocketSessionRegistry = webSocketSessionRegistry;
    }

    public TransactionResultResponseDTO report(String txHash,
                                               String userAddress,
                                               String agentId,
                                               String functionName,
                                               String targetAddress) {
        TransactionOutcomeVO outcome = transactionResultDomainService.report(txHash, userAddress, agentId,
                functionName, targetAddress);
        notifyUser(userAddress, outcome);
        return toDTO(outcome);
    }

    public TransactionResultResponseDTO confirm(String txHash, String userAddress, String agentId, String functionName) {
        TransactionOutcomeVO outcome = transactionResultDomainService.confirm(txHash, userAddress, agentId, functionName);
        if (!outcome.isPending()) {
            notifyUser(userAddress, outcome);
        }
        return toDTO(outcome);
    }

    private void notifyUser(String userAddress, TransactionOutcomeVO outcome) {
        ChatSocketEventDTO event = ChatSocketEventDTO.of(EVENT_TRANSACTION_RESULT, outcome.getMessage());
        event.setTxHash(outcome.getTxHash());
        int delivered = webSocketSessionRegistry.publish(userAddress, event);
        log.debug("TX_RESULT_PUSHED txHash={}, status={}, delivered={}", outcome.getTxHash(), outcome.getStatus(), delivered);
    }

    private TransactionResultResponseDTO toDTO(TransactionOutcomeVO outcome) {
        TransactionResultResponseDTO dto = new TransactionResultResponseDTO();
        dto.setResponse(outcome.getMessage());
        dto.setStatus(outcome.getStatus());
        dto.setTxHash(outcome.getTxHash());
        dto.setBlockNumber(outcome.getBlockNumber());
        dto.setGasUsed(outcome.getGasUsed());
        return dto;
    }
}
