package com.contractmind.infrastructure.dao;

import com.contractmind.infrastructure.dao.po.ChatMessagePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 对话消息 DAO。
 */
@Mapper
public interface ChatMessageDao {

    int insert(ChatMessagePO po);

    ChatMessagePO selectById(@Param("id") Long id);

    /**
     * 按时间倒序取最近 limit 条
     */
    List<ChatMessagePO> selectRecent(@Param("agentId") String agentId,
                                     @Param("userAddress") String userAddress,
                                     @Param("limit") int limit);
}
