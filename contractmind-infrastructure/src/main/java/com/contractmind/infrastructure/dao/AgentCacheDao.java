package com.contractmind.infrastructure.dao;

import com.contractmind.infrastructure.dao.po.AgentCachePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Agent 缓存表 DAO。
 */
@Mapper
public interface AgentCacheDao {

    /**
     * 按 agent_id 插入或覆盖
     */
    int upsert(AgentCachePO po);

    int update(AgentCachePO po);

    int deleteByAgentId(@Param("agentId") String agentId);

    AgentCachePO selectByAgentId(@Param("agentId") String agentId);

    /**
     * 名称忽略大小写匹配，多条时取最近更新的一条
     */
    AgentCachePO selectByName(@Param("name") String name);

    List<AgentCachePO> selectAll();

    List<AgentCachePO> selectByActive(@Param("active") Boolean active);
}
