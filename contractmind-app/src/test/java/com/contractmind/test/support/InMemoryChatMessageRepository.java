package com.contractmind.test.support;

import com.contractmind.domain.chat.adapter.repository.IChatMessageRepository;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存聊天消息仓储。
 */
public class InMemoryChatMessageRepository implements IChatMessageRepository {

    private final List<ChatTurnEntity> store = new ArrayList<>();
    private long nextId = 1;

    @Override
    public ChatTurnEntity save(ChatTurnEntity turn) {
        turn.setId(nextId++);
        store.add(turn);
        return turn;
    }

    @Override
    public List<ChatTurnEntity> findRecent(String agentId, String userAddress, int limit) {
        return store.stream()
                .filter(item -> Objects.equals(agentId, item.getAgentId()))
                .filter(item -> Objects.equals(userAddress, item.getUserAddress()))
                .sorted(Comparator.comparing(ChatTurnEntity::getId).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<ChatTurnEntity> all() {
        return new ArrayList<>(store);
    }
}
