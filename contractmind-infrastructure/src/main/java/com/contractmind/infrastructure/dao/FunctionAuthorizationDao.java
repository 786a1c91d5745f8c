package com.contractmind.infrastructure.dao;

import com.contractmind.infrastructure.dao.po.FunctionAuthorizationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 函数授权表 DAO。
 */
@Mapper
public interface FunctionAuthorizationDao {

    int upsert(FunctionAuthorizationPO po);

    int deleteByAgentId(@Param("agentId") String agentId);

    List<FunctionAuthorizationPO> selectByAgentId(@Param("agentId") String agentId);
}
