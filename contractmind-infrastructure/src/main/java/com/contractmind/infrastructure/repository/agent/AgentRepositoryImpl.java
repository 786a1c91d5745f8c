package com.contractmind.infrastructure.repository.agent;

import com.contractmind.domain.agent.adapter.repository.IAgentRepository;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.infrastructure.dao.AgentCacheDao;
import com.contractmind.infrastructure.dao.po.AgentCachePO;
import com.contractmind.infrastructure.util.JsonCodec;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 缓存仓储实现。
 */
@Slf4j
@Repository
public class AgentRepositoryImpl implements IAgentRepository {

    private final AgentCacheDao agentCacheDao;
    private final JsonCodec jsonCodec;

    public AgentRepositoryImpl(AgentCacheDao agentCacheDao, JsonCodec jsonCodec) {
        this.agentCacheDao = agentCacheDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentEntity save(AgentEntity entity) {
        entity.validate();
        agentCacheDao.upsert(toPO(entity));
        return findByAgentId(entity.getAgentId());
    }

    @Override
    public AgentEntity update(AgentEntity entity) {
        entity.validate();
        int rows = agentCacheDao.update(toPO(entity));
        if (rows <= 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "Agent not found: " + entity.getAgentId());
        }
        return findByAgentId(entity.getAgentId());
    }

    @Override
    public boolean deleteByAgentId(String agentId) {
        return agentCacheDao.deleteByAgentId(agentId) > 0;
    }

    @Override
    public AgentEntity findByAgentId(String agentId) {
        return toEntity(agentCacheDao.selectByAgentId(agentId));
    }

    @Override
    public AgentEntity findByName(String name) {
        return toEntity(agentCacheDao.selectByName(name));
    }

    @Override
    public List<AgentEntity> findAll() {
        return toEntities(agentCacheDao.selectAll());
    }

    @Override
    public List<AgentEntity> findByActive(Boolean isActive) {
        return toEntities(agentCacheDao.selectByActive(isActive));
    }

    private List<AgentEntity> toEntities(List<AgentCachePO> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private AgentEntity toEntity(AgentCachePO po) {
        if (po == null) {
            return null;
        }
        AgentEntity entity = new AgentEntity();
        entity.setAgentId(po.getAgentId());
        entity.setOwner(po.getOwner());
        entity.setTargetAddress(po.getTargetAddress());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setConfigIpfs(po.getConfigIpfs());
        entity.setIsActive(po.getActive());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        if (po.getAbi() != null) {
            try {
                entity.setAbi(jsonCodec.readMapList(po.getAbi()));
            } catch (AppException ex) {
                log.warn("AGENT_ABI_UNREADABLE agentId={}, error={}", po.getAgentId(), ex.getMessage());
            }
        }
        return entity;
    }

    private AgentCachePO toPO(AgentEntity entity) {
        return AgentCachePO.builder()
                .agentId(entity.getAgentId())
                .owner(entity.getOwner())
                .targetAddress(entity.getTargetAddress())
                .name(entity.getName())
                .description(entity.getDescription())
                .configIpfs(entity.getConfigIpfs())
                .abi(entity.getAbi() == null ? null : jsonCodec.writeValue(entity.getAbi()))
                .active(entity.getIsActive() == null ? Boolean.TRUE : entity.getIsActive())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
