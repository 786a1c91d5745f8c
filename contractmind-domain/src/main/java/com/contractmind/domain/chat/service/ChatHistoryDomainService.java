package com.contractmind.domain.chat.service;

import com.contractmind.domain.chat.adapter.gateway.ITelemetrySink;
import com.contractmind.domain.chat.adapter.repository.IChatMessageRepository;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.types.enums.TelemetrySchemaEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 对话历史领域服务。
 * <p>
 * 历史读写都是尽力而为：存储故障只记 warn，不影响当前请求。
 * </p>
 */
@Slf4j
@Service
public class ChatHistoryDomainService {

    private final IChatMessageRepository chatMessageRepository;
    private final ITelemetrySink telemetrySink;

    public ChatHistoryDomainService(IChatMessageRepository chatMessageRepository, ITelemetrySink telemetrySink) {
        this.chatMessageRepository = chatMessageRepository;
        this.telemetrySink = telemetrySink;
    }

    /**
     * 最近 limit 条消息，按时间正序返回。
     */
    public List<ChatTurnEntity> recentTurns(String agentId, String userAddress, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        try {
            List<ChatTurnEntity> newestFirst = chatMessageRepository.findRecent(agentId, normalize(userAddress), limit);
            if (newestFirst == null || newestFirst.isEmpty()) {
                return Collections.emptyList();
            }
            List<ChatTurnEntity> chronological = new ArrayList<>(newestFirst);
            Collections.reverse(chronological);
            return chronological;
        } catch (Exception ex) {
            log.warn("CHAT_HISTORY_LOAD_FAILED agentId={}, user={}, error={}", agentId, userAddress, ex.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * 查询历史，按时间倒序。
     */
    public List<ChatTurnEntity> history(String agentId, String userAddress, int limit) {
        return chatMessageRepository.findRecent(agentId, normalize(userAddress), limit);
    }

    public void append(ChatTurnEntity turn) {
        if (turn == null) {
            return;
        }
        turn.setUserAddress(normalize(turn.getUserAddress()));
        try {
            chatMessageRepository.save(turn);
        } catch (Exception ex) {
            log.warn("CHAT_HISTORY_SAVE_FAILED agentId={}, role={}, error={}",
                    turn.getAgentId(), turn.getRole(), ex.getMessage());
            return;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("agentId", turn.getAgentId());
        record.put("userAddress", turn.getUserAddress());
        record.put("role", turn.getRole() == null ? null : turn.getRole().getCode());
        record.put("message", turn.getMessage());
        record.put("functionName", turn.getFunctionName());
        record.put("transactionHash", turn.getTransactionHash());
        telemetrySink.publish(TelemetrySchemaEnum.CHAT_MESSAGE, record);
    }

    static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }
}
