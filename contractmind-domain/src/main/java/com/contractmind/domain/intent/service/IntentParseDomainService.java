package com.contractmind.domain.intent.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;
import com.contractmind.domain.transaction.model.valobj.CoercionSettingsVO;
import com.contractmind.domain.transaction.service.ParameterCoercionDomainService;
import com.contractmind.types.enums.IntentSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 意图解析领域服务：大模型优先、关键词兜底，并对两条路径的结果做统一校验与参数归一化。
 * <p>
 * 本方法永不因解析失败抛异常；参数归一化在此处且只在此处执行一次。
 * </p>
 */
@Slf4j
@Service
public class IntentParseDomainService {

    static final String EMPTY_CATALOG_REPLY =
            "Sorry, I don't have access to the contract's functions. Please make sure the agent has a valid ABI configured.";

    private final IIntentParser llmIntentParser;
    private final IIntentParser keywordIntentParser;
    private final ParameterCoercionDomainService coercionDomainService;
    private final CoercionSettingsVO coercionSettings;

    public IntentParseDomainService(LlmIntentParser llmIntentParser,
                                    KeywordIntentParser keywordIntentParser,
                                    ParameterCoercionDomainService coercionDomainService,
                                    CoercionSettingsVO coercionSettings) {
        this.llmIntentParser = llmIntentParser;
        this.keywordIntentParser = keywordIntentParser;
        this.coercionDomainService = coercionDomainService;
        this.coercionSettings = coercionSettings == null ? CoercionSettingsVO.defaults() : coercionSettings;
    }

    public ParsedIntentVO parse(IntentParseContextVO context) {
        FunctionCatalogVO catalog = context.safeCatalog();
        if (catalog.isEmpty()) {
            return ParsedIntentVO.builder()
                    .response(EMPTY_CATALOG_REPLY)
                    .confidence(1D)
                    .source(IntentSourceEnum.SYSTEM)
                    .build();
        }

        ParsedIntentVO intent;
        try {
            intent = llmIntentParser.parse(context);
        } catch (Exception ex) {
            log.warn("INTENT_LLM_FALLBACK agent={}, error={}", context.getAgentName(), ex.getMessage());
            intent = keywordIntentParser.parse(context);
        }
        if (intent.getAmount() == null) {
            intent.setAmount(KeywordIntentParser.extractAmount(context.getMessage()));
        }
        if (intent.getToken() == null) {
            intent.setToken(KeywordIntentParser.extractToken(context.getMessage()));
        }

        if (intent.hasFunction()) {
            validate(intent, catalog);
        }
        if (intent.hasFunction()) {
            FunctionDescriptorVO function = catalog.find(intent.getFunctionName());
            intent.setRequiresTransaction(!function.isReadOnly());
            completeMissingParams(intent, function);
            int decimals = coercionSettings.resolveDecimals(function.getName(), intent.getToken());
            intent.setParams(coercionDomainService.coerce(intent.getRawParams(), function.safeInputs(),
                    context.getUserAddress(), decimals));
        }
        log.info("INTENT_PARSED source={}, function={}, requiresTransaction={}, needsMoreInfo={}, confidence={}",
                intent.getSource(), intent.getFunctionName(), intent.isRequiresTransaction(),
                intent.isNeedsMoreInfo(), intent.getConfidence());
        return intent;
    }

    /**
     * 函数必须在目录中存在且已授权，否则清空函数与参数并给出拒绝文案。
     */
    private void validate(ParsedIntentVO intent, FunctionCatalogVO catalog) {
        String name = intent.getFunctionName();
        FunctionDescriptorVO function = catalog.find(name);
        if (function == null && intent.getSource() == IntentSourceEnum.KEYWORD) {
            function = catalog.findIgnoreCase(name);
            if (function != null) {
                intent.setFunctionName(function.getName());
            }
        }
        if (function == null) {
            intent.reject("Sorry, the function '" + name + "' is not available on this contract.");
            return;
        }
        if (!function.isAuthorized()) {
            intent.reject("Sorry, the function '" + name
                    + "' is not authorized for this agent. Please contact the agent owner to authorize it.");
        }
    }

    /**
     * 交易类函数的缺失参数按 ABI 补齐，防止模型漏报。
     */
    private void completeMissingParams(ParsedIntentVO intent, FunctionDescriptorVO function) {
        if (!intent.isRequiresTransaction()) {
            intent.setNeedsMoreInfo(false);
            intent.setMissingParams(new ArrayList<>());
            return;
        }
        Map<String, Object> raw = intent.getRawParams();
        List<String> missing = new ArrayList<>(intent.getMissingParams() == null ? List.of() : intent.getMissingParams());
        List<String> declared = function.safeInputs().stream().map(AbiParameterVO::getName).toList();
        missing.removeIf(name -> !declared.contains(name) || raw != null && raw.get(name) != null);
        for (AbiParameterVO input : function.safeInputs()) {
            if ((raw == null || raw.get(input.getName()) == null) && !missing.contains(input.getName())) {
                missing.add(input.getName());
            }
        }
        intent.setMissingParams(missing);
        intent.setNeedsMoreInfo(!missing.isEmpty());
    }
}
