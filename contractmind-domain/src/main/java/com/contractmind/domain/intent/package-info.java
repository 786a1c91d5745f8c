/**
 * Intent 领域 - 自然语言意图解析
 *
 * <p>职责：用户消息 + 对话上下文 + 函数目录 → {@link com.contractmind.domain.intent.model.valobj.ParsedIntentVO}</p>
 *
 * <h3>解析策略</h3>
 * <ul>
 *   <li>LlmIntentParser - 大模型结构化 JSON 输出</li>
 *   <li>KeywordIntentParser - 确定性的关键词兜底，永不抛异常</li>
 * </ul>
 *
 * <p>两条路径的结果都经过同一套校验：函数必须存在且已授权，随后做一次参数归一化。</p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
package com.contractmind.domain.intent;
