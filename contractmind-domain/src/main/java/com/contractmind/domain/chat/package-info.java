/**
 * Chat 领域 - 对话历史与交易结果
 *
 * <p>职责：保存用户与 Agent 的对话轮次、跟踪用户签名广播后的交易状态，并投递遥测事件</p>
 *
 * <h3>实体</h3>
 * <ul>
 *   <li>{@link com.contractmind.domain.chat.model.entity.ChatTurnEntity} - 单条对话消息</li>
 *   <li>{@link com.contractmind.domain.chat.model.entity.TransactionRecordEntity} - 交易记录，txHash 唯一</li>
 * </ul>
 *
 * <h3>状态转换</h3>
 * <pre>
 * PENDING → CONFIRMED
 * PENDING → FAILED
 * </pre>
 *
 * @author getoffer
 * @since 2025-10-02
 */
package com.contractmind.domain.chat;
