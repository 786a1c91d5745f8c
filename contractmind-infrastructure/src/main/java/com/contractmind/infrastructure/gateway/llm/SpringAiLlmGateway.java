package com.contractmind.infrastructure.gateway.llm;

import com.contractmind.domain.intent.adapter.gateway.ILlmGateway;
import com.contractmind.infrastructure.util.JsonCodec;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI ChatClient 的大模型网关。
 * <p>
 * 调用在公共线程池上执行，调用方最多等待 timeout 秒；超时不强制取消底层请求。
 * 输出先按整体 JSON 解析，失败再截取第一个 '{' 到最后一个 '}' 之间的内容。
 * </p>
 */
@Slf4j
@Component
public class SpringAiLlmGateway implements ILlmGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final JsonCodec jsonCodec;
    private final Executor executor;
    private final long timeoutSeconds;

    public SpringAiLlmGateway(ObjectProvider<ChatModel> chatModelProvider,
                              JsonCodec jsonCodec,
                              @Qualifier("commonThreadPoolExecutor") Executor executor,
                              @Value("${contractmind.llm.timeout-seconds:30}") long timeoutSeconds) {
        this.chatModelProvider = chatModelProvider;
        this.jsonCodec = jsonCodec;
        this.executor = executor;
        this.timeoutSeconds = timeoutSeconds <= 0 ? 30L : timeoutSeconds;
    }

    @Override
    public Map<String, Object> generateStructuredJson(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AppException(ResponseCode.LLM_ERROR, "No chat model configured");
        }
        ChatClient chatClient = ChatClient.builder(chatModel).build();
        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        long start = System.currentTimeMillis();
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(options)
                .call()
                .content(), executor);
        String content;
        try {
            content = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            throw new AppException(ResponseCode.LLM_ERROR, "LLM call timed out after " + timeoutSeconds + "s", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.LLM_ERROR, "LLM call interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new AppException(ResponseCode.LLM_ERROR, "LLM call failed: " + cause.getMessage(), cause);
        }
        log.debug("LLM_CALL_DONE costMs={}, length={}", System.currentTimeMillis() - start,
                content == null ? 0 : content.length());
        return parsePayload(content);
    }

    Map<String, Object> parsePayload(String content) {
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.LLM_ERROR, "LLM returned empty content");
        }
        Map<String, Object> payload = tryReadMap(content.trim());
        if (payload != null) {
            return payload;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            payload = tryReadMap(content.substring(start, end + 1));
            if (payload != null) {
                return payload;
            }
        }
        throw new AppException(ResponseCode.LLM_ERROR, "LLM output is not a valid JSON object");
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return jsonCodec.readMap(text);
        } catch (Exception ex) {
            log.debug("Failed to parse llm json: {}", ex.getMessage());
            return null;
        }
    }
}
