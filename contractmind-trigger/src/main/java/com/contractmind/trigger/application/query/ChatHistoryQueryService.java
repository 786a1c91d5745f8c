package com.contractmind.trigger.application.query;

import com.contractmind.api.dto.ChatHistoryItemDTO;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.domain.chat.service.ChatHistoryDomainService;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 聊天历史读用例。
 */
@Service
public class ChatHistoryQueryService {

    static final int MAX_LIMIT = 200;

    private final ChatHistoryDomainService chatHistoryDomainService;

    public ChatHistoryQueryService(ChatHistoryDomainService chatHistoryDomainService) {
        this.chatHistoryDomainService = chatHistoryDomainService;
    }

    public List<ChatHistoryItemDTO> getHistory(String agentId, String userAddress, Integer limit) {
        if (StringUtils.isBlank(agentId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "agentId is required");
        }
        if (StringUtils.isBlank(userAddress)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userAddress is required");
        }
        int resolvedLimit = limit == null || limit <= 0 ? 50 : Math.min(limit, MAX_LIMIT);
        return chatHistoryDomainService.history(agentId.trim(), userAddress.trim(), resolvedLimit).stream()
                .map(this::toDTO)
                .collect(Collectors.toList());
    }

    private ChatHistoryItemDTO toDTO(ChatTurnEntity turn) {
        ChatHistoryItemDTO dto = new ChatHistoryItemDTO();
        dto.setId(turn.getId());
        dto.setAgentId(turn.getAgentId());
        dto.setUserAddress(turn.getUserAddress());
        dto.setRole(turn.getRole() == null ? null : turn.getRole().getCode());
        dto.setMessage(turn.getMessage());
        dto.setFunctionName(turn.getFunctionName());
        dto.setRequiresTransaction(turn.getRequiresTransaction());
        dto.setTransactionHash(turn.getTransactionHash());
        dto.setCreatedAt(turn.getCreatedAt());
        return dto;
    }
}
