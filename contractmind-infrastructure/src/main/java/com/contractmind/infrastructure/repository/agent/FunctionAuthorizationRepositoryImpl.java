package com.contractmind.infrastructure.repository.agent;

import com.contractmind.domain.agent.adapter.repository.IFunctionAuthorizationRepository;
import com.contractmind.infrastructure.dao.FunctionAuthorizationDao;
import com.contractmind.infrastructure.dao.po.FunctionAuthorizationPO;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 函数授权仓储实现。
 */
@Repository
public class FunctionAuthorizationRepositoryImpl implements IFunctionAuthorizationRepository {

    private final FunctionAuthorizationDao functionAuthorizationDao;

    public FunctionAuthorizationRepositoryImpl(FunctionAuthorizationDao functionAuthorizationDao) {
        this.functionAuthorizationDao = functionAuthorizationDao;
    }

    @Override
    public Map<String, Boolean> findByAgentId(String agentId) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        List<FunctionAuthorizationPO> rows = functionAuthorizationDao.selectByAgentId(agentId);
        if (rows == null) {
            return result;
        }
        for (FunctionAuthorizationPO row : rows) {
            result.put(row.getFunctionName(), Boolean.TRUE.equals(row.getAuthorized()));
        }
        return result;
    }

    @Override
    public void upsert(String agentId, String functionName, boolean authorized) {
        functionAuthorizationDao.upsert(FunctionAuthorizationPO.builder()
                .agentId(agentId)
                .functionName(functionName)
                .authorized(authorized)
                .build());
    }

    @Override
    public int deleteByAgentId(String agentId) {
        return functionAuthorizationDao.deleteByAgentId(agentId);
    }
}
