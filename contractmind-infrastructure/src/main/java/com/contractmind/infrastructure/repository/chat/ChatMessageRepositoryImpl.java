package com.contractmind.infrastructure.repository.chat;

import com.contractmind.domain.chat.adapter.repository.IChatMessageRepository;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.infrastructure.dao.ChatMessageDao;
import com.contractmind.infrastructure.dao.po.ChatMessagePO;
import com.contractmind.types.enums.MessageRoleEnum;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对话消息仓储实现。
 */
@Repository
public class ChatMessageRepositoryImpl implements IChatMessageRepository {

    private final ChatMessageDao chatMessageDao;

    public ChatMessageRepositoryImpl(ChatMessageDao chatMessageDao) {
        this.chatMessageDao = chatMessageDao;
    }

    @Override
    public ChatTurnEntity save(ChatTurnEntity turn) {
        ChatMessagePO po = ChatMessagePO.builder()
                .agentId(turn.getAgentId())
                .userAddress(turn.getUserAddress())
                .role(turn.getRole() == null ? MessageRoleEnum.USER.getCode() : turn.getRole().getCode())
                .message(turn.getMessage())
                .functionName(turn.getFunctionName())
                .requiresTransaction(Boolean.TRUE.equals(turn.getRequiresTransaction()))
                .transactionHash(turn.getTransactionHash())
                .build();
        chatMessageDao.insert(po);
        ChatMessagePO stored = po.getId() == null ? null : chatMessageDao.selectById(po.getId());
        return toEntity(stored == null ? po : stored);
    }

    @Override
    public List<ChatTurnEntity> findRecent(String agentId, String userAddress, int limit) {
        List<ChatMessagePO> rows = chatMessageDao.selectRecent(agentId, userAddress, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private ChatTurnEntity toEntity(ChatMessagePO po) {
        ChatTurnEntity entity = new ChatTurnEntity();
        entity.setId(po.getId());
        entity.setAgentId(po.getAgentId());
        entity.setUserAddress(po.getUserAddress());
        entity.setRole(MessageRoleEnum.fromCode(po.getRole()));
        entity.setMessage(po.getMessage());
        entity.setFunctionName(po.getFunctionName());
        entity.setRequiresTransaction(po.getRequiresTransaction());
        entity.setTransactionHash(po.getTransactionHash());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
