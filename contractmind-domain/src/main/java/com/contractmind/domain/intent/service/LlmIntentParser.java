package com.contractmind.domain.intent.service;

import com.contractmind.domain.intent.adapter.gateway.ILlmGateway;
import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.IntentParserSettingsVO;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;
import com.contractmind.types.enums.IntentSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 大模型意图解析策略，失败直接抛出，由上层降级到关键词解析。
 */
@Slf4j
@Service
public class LlmIntentParser implements IIntentParser {

    static final double DEFAULT_CONFIDENCE = 0.8D;

    private final ILlmGateway llmGateway;
    private final IntentPromptDomainService promptDomainService;
    private final IntentParserSettingsVO settings;

    public LlmIntentParser(ILlmGateway llmGateway,
                           IntentPromptDomainService promptDomainService,
                           IntentParserSettingsVO settings) {
        this.llmGateway = llmGateway;
        this.promptDomainService = promptDomainService;
        this.settings = settings == null ? IntentParserSettingsVO.defaults() : settings;
    }

    @Override
    public ParsedIntentVO parse(IntentParseContextVO context) {
        String systemPrompt = promptDomainService.buildSystemPrompt(context);
        String userPrompt = promptDomainService.buildUserPrompt(context);
        Map<String, Object> payload = llmGateway.generateStructuredJson(systemPrompt, userPrompt,
                settings.getTemperature() == null ? 0.7D : settings.getTemperature(),
                settings.getMaxTokens() == null ? 2000 : settings.getMaxTokens());
        ParsedIntentVO intent = toIntent(payload);
        log.info("INTENT_LLM_PARSED function={}, needsMoreInfo={}, confidence={}",
                intent.getFunctionName(), intent.isNeedsMoreInfo(), intent.getConfidence());
        return intent;
    }

    ParsedIntentVO toIntent(Map<String, Object> payload) {
        Map<String, Object> params = getMap(payload, "params");
        return ParsedIntentVO.builder()
                .functionName(getFunctionName(payload))
                .requiresTransaction(getBoolean(payload, "requiresTransaction"))
                .needsMoreInfo(getBoolean(payload, "needsMoreInfo"))
                .response(getString(payload, "response"))
                .params(new LinkedHashMap<>(params))
                .rawParams(new LinkedHashMap<>(params))
                .missingParams(getStringList(payload, "missingParams"))
                .confidence(getConfidence(payload))
                .source(IntentSourceEnum.LLM)
                .build();
    }

    private String getFunctionName(Map<String, Object> payload) {
        String name = getString(payload, "functionName");
        if (StringUtils.isBlank(name) || "null".equalsIgnoreCase(name.trim())) {
            return null;
        }
        return name.trim();
    }

    private double getConfidence(Map<String, Object> payload) {
        Object value = payload.get("confidence");
        double confidence = DEFAULT_CONFIDENCE;
        if (value instanceof Number number) {
            confidence = number.doubleValue();
        } else if (value instanceof String text && StringUtils.isNotBlank(text)) {
            try {
                confidence = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                confidence = DEFAULT_CONFIDENCE;
            }
        }
        if (Double.isNaN(confidence)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0D, Math.min(1D, confidence));
    }

    private boolean getBoolean(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value).trim());
    }

    private String getString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMap(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        return new LinkedHashMap<>();
    }

    private List<String> getStringList(Map<String, Object> payload, String key) {
        List<String> result = new ArrayList<>();
        Object value = payload.get(key);
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && StringUtils.isNotBlank(String.valueOf(item))) {
                    result.add(String.valueOf(item));
                }
            }
        }
        return result;
    }
}
