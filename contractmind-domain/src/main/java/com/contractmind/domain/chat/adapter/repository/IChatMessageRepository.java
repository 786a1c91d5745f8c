package com.contractmind.domain.chat.adapter.repository;

import com.contractmind.domain.chat.model.entity.ChatTurnEntity;

import java.util.List;

/**
 * 对话消息仓储接口
 *
 * @author getoffer
 * @since 2025-10-02
 */
public interface IChatMessageRepository {

    /**
     * 保存消息，回填 id 与 createdAt
     */
    ChatTurnEntity save(ChatTurnEntity turn);

    /**
     * 最近 limit 条消息，按时间倒序
     */
    List<ChatTurnEntity> findRecent(String agentId, String userAddress, int limit);
}
