package com.contractmind.domain.intent.adapter.gateway;

import java.util.Map;

/**
 * 大模型调用端口。
 */
public interface ILlmGateway {

    /**
     * 生成结构化 JSON 输出。
     * 超时、空输出或无法解析为 JSON 对象时抛出 LLM_ERROR 的 AppException。
     *
     * @param systemPrompt 系统提示词
     * @param userPrompt   用户提示词
     * @param temperature  采样温度
     * @param maxTokens    最大输出 token
     * @return JSON 对象
     */
    Map<String, Object> generateStructuredJson(String systemPrompt, String userPrompt, double temperature, int maxTokens);
}
