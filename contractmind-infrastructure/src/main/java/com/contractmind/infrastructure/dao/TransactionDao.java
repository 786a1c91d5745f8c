package com.contractmind.infrastructure.dao;

import com.contractmind.infrastructure.dao.po.AgentUsagePO;
import com.contractmind.infrastructure.dao.po.TransactionPO;
import com.contractmind.infrastructure.dao.po.TransactionStatsPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交易记录 DAO。
 */
@Mapper
public interface TransactionDao {

    int insert(TransactionPO po);

    int updateStatus(TransactionPO po);

    TransactionPO selectByTxHash(@Param("txHash") String txHash);

    List<TransactionPO> selectByUserAddress(@Param("userAddress") String userAddress, @Param("limit") int limit);

    List<TransactionPO> selectByAgentId(@Param("agentId") String agentId, @Param("limit") int limit);

    /**
     * 聚合统计，参数为空时不参与过滤
     */
    TransactionStatsPO selectStats(@Param("userAddress") String userAddress,
                                   @Param("agentId") String agentId,
                                   @Param("since") LocalDateTime since);

    List<AgentUsagePO> selectTopProtocols(@Param("userAddress") String userAddress, @Param("limit") int limit);

    long countSince(@Param("since") LocalDateTime since);
}
