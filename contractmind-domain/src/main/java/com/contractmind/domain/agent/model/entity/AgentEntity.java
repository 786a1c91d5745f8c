package com.contractmind.domain.agent.model.entity;

import com.contractmind.types.common.Constants;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Agent 领域实体：逻辑名称到链上目标合约的注册映射。
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Data
public class AgentEntity {

    /**
     * Agent 标识（链上 bytes32 句柄，hex 或注册时的字符串）
     */
    private String agentId;

    /**
     * 所有者地址
     */
    private String owner;

    /**
     * 目标合约地址
     */
    private String targetAddress;

    /**
     * 展示名称
     */
    private String name;

    /**
     * 描述
     */
    private String description;

    /**
     * 配置文件 IPFS 地址
     */
    private String configIpfs;

    /**
     * 原始 JSON ABI
     */
    private List<Map<String, Object>> abi;

    /**
     * 是否激活
     */
    private Boolean isActive;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 验证 Agent 是否满足不变量
     */
    public void validate() {
        if (agentId == null || agentId.trim().isEmpty()) {
            throw new IllegalStateException("Agent id cannot be empty");
        }
        if (!isValidAddress(targetAddress)) {
            throw new IllegalStateException("Agent target address is invalid: " + targetAddress);
        }
        if (abi != null) {
            for (Map<String, Object> item : abi) {
                if (item == null) {
                    throw new IllegalStateException("Agent ABI contains null entry");
                }
            }
        }
    }

    public boolean hasAbi() {
        return abi != null && !abi.isEmpty();
    }

    public boolean isActiveAgent() {
        return !Boolean.FALSE.equals(isActive);
    }

    /**
     * 激活 Agent
     */
    public void activate() {
        this.isActive = true;
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    /**
     * 停用 Agent（软删除）
     */
    public void deactivate() {
        this.isActive = false;
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    /**
     * 更新元数据，参数为 null 表示不修改
     */
    public void updateMetadata(String name, String description, List<Map<String, Object>> abi) {
        if (name != null) {
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
        if (abi != null) {
            this.abi = abi;
        }
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
        validate();
    }

    public static boolean isValidAddress(String address) {
        return address != null && address.matches(Constants.ADDRESS_REGEX);
    }
}
