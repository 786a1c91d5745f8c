/**
 * Agent 领域 - 合约代理目录
 *
 * <p>职责：维护 Agent（逻辑名称 → 目标合约 + ABI）映射，以及每个函数的授权开关</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.contractmind.domain.agent.model.entity.AgentEntity}</li>
 * </ul>
 *
 * <h3>值对象</h3>
 * <ul>
 *   <li>FunctionDescriptorVO - ABI 解析后的函数描述，随 ABI 或授权表变化重新计算，不单独持久化</li>
 *   <li>FunctionCatalogVO - 按名称索引的函数目录</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>AbiFunctionCatalogDomainService - 原始 ABI → 类型化函数目录</li>
 *   <li>AgentDirectoryDomainService - 缓存优先、链上注册表兜底的 Agent 查询</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-10-02
 */
package com.contractmind.domain.agent;
