/**
 * Analytics 领域 - 交易统计
 *
 * <p>职责：基于 transactions 表按用户、Agent 与全平台维度聚合交易数量、Gas 消耗与成功率</p>
 *
 * <h3>统计口径</h3>
 * <ul>
 *   <li>成功率 = 状态为 confirmed 的记录数 / 窗口内全部记录数（pending 计入分母）</li>
 *   <li>常用 Agent、最近活动与热门 Agent 不受时间窗口限制</li>
 *   <li>近 24 小时交易数固定按 24 小时计算</li>
 * </ul>
 *
 * @author getoffer
 * @since 2025-10-02
 */
package com.contractmind.domain.analytics;
