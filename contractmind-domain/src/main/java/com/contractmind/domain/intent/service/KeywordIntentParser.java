package com.contractmind.domain.intent.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;
import com.contractmind.types.enums.IntentSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 关键词兜底解析策略。
 * <p>
 * 纯本地计算，不抛异常。动作表按顺序匹配（小写子串），第一个在目录中存在候选函数的关键词胜出；
 * 只读类关键词排在交易类之前。
 * </p>
 */
@Slf4j
@Service
public class KeywordIntentParser implements IIntentParser {

    static final double KEYWORD_CONFIDENCE = 0.3D;

    private static final Pattern GREETING = Pattern.compile(
            "\\b(hello|hi|hey|greetings|good morning|good afternoon|good evening)\\b");
    private static final List<String> THANKS_KEYWORDS = List.of("thank", "thanks", "appreciate");
    private static final List<String> HELP_KEYWORDS = List.of("help", "what can you do", "capabilities", "features");

    private static final Pattern AMOUNT = Pattern.compile("(?<![0-9A-Za-z.])(\\d+(?:\\.\\d+)?)(?![0-9A-Za-z])");
    private static final Pattern TOKEN = Pattern.compile("(?<![0-9A-Za-z.])\\d+(?:\\.\\d+)?\\s+([A-Z][A-Z0-9]{1,9})\\b");
    private static final Pattern ADDRESS = Pattern.compile("0x[0-9a-fA-F]{40}");
    private static final Pattern SELF_REFERENCE = Pattern.compile("\\b(me|my|myself)\\b");

    private static final List<KeywordRule> ACTION_TABLE = List.of(
            new KeywordRule("balance", List.of("balanceOf")),
            new KeywordRule("allowance", List.of("allowance")),
            new KeywordRule("total supply", List.of("totalSupply")),
            new KeywordRule("decimals", List.of("decimals")),
            new KeywordRule("symbol", List.of("symbol")),
            new KeywordRule("owner", List.of("owner")),
            new KeywordRule("unstake", List.of("unstake", "withdraw")),
            new KeywordRule("withdraw", List.of("withdraw")),
            new KeywordRule("stake", List.of("stake")),
            new KeywordRule("swap", List.of("swap")),
            new KeywordRule("claim", List.of("claim", "claimRewards")),
            new KeywordRule("lend", List.of("lend")),
            new KeywordRule("borrow", List.of("borrow")),
            new KeywordRule("transfer", List.of("transfer")),
            new KeywordRule("send", List.of("transfer")),
            new KeywordRule("approve", List.of("approve")),
            new KeywordRule("mint", List.of("mint")));

    @Override
    public ParsedIntentVO parse(IntentParseContextVO context) {
        String message = StringUtils.defaultString(context.getMessage());
        String lower = message.toLowerCase(Locale.ROOT);
        FunctionCatalogVO catalog = context.safeCatalog();
        String amount = extractAmount(message);
        String token = extractToken(message);

        if (GREETING.matcher(lower).find()) {
            return reply("Hello! I'm " + StringUtils.defaultIfBlank(context.getAgentName(), "your assistant")
                    + ", your AI assistant for interacting with smart contracts. I can help you with: "
                    + functionNames(catalog, 8) + ". Just ask me in natural language!");
        }
        if (containsAny(lower, THANKS_KEYWORDS)) {
            return reply("You're welcome! Let me know if you need anything else.");
        }
        if (containsAny(lower, HELP_KEYWORDS)) {
            return reply("I can help you interact with this smart contract. Available functions: "
                    + functionNames(catalog, 8) + ". Try asking things like 'What is my balance?' or 'Transfer tokens'.");
        }

        for (KeywordRule rule : ACTION_TABLE) {
            if (!lower.contains(rule.keyword())) {
                continue;
            }
            FunctionDescriptorVO function = firstCandidate(catalog, rule.candidates());
            if (function == null) {
                continue;
            }
            log.debug("INTENT_KEYWORD_MATCHED keyword={}, function={}", rule.keyword(), function.getName());
            return matched(function, message, lower, amount, token);
        }

        return ParsedIntentVO.builder()
                .response("I'm not sure how to help with that. I can assist with: "
                        + functionNames(catalog, 5) + ". What would you like to do?")
                .confidence(KEYWORD_CONFIDENCE)
                .source(IntentSourceEnum.KEYWORD)
                .amount(amount)
                .token(token)
                .build();
    }

    /**
     * 消息中第一个独立数字（不含 0x 地址内的数字）。
     */
    public static String extractAmount(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = AMOUNT.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * 紧跟在数字后面的大写代币符号，如 "100 USDC"。
     */
    public static String extractToken(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = TOKEN.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }

    private ParsedIntentVO matched(FunctionDescriptorVO function, String message, String lower, String amount, String token) {
        boolean requiresTransaction = !function.isReadOnly();
        Map<String, Object> params = new LinkedHashMap<>();
        List<AbiParameterVO> amountInputs = inputsOfType(function, "uint256");
        if (amount != null && amountInputs.size() == 1) {
            params.put(amountInputs.get(0).getName(), amount);
        }
        List<AbiParameterVO> addressInputs = inputsOfType(function, "address");
        if (addressInputs.size() == 1) {
            Matcher address = ADDRESS.matcher(message);
            if (address.find()) {
                params.put(addressInputs.get(0).getName(), address.group());
            } else if (SELF_REFERENCE.matcher(lower).find()) {
                params.put(addressInputs.get(0).getName(), "me");
            }
        }

        List<String> missing = new ArrayList<>();
        if (requiresTransaction) {
            for (AbiParameterVO input : function.safeInputs()) {
                if (!params.containsKey(input.getName())) {
                    missing.add(input.getName());
                }
            }
        }
        String response = requiresTransaction
                ? "I'll prepare a transaction to call " + function.getName() + "."
                : "I'll check the " + function.getName() + " for you.";
        return ParsedIntentVO.builder()
                .functionName(function.getName())
                .requiresTransaction(requiresTransaction)
                .needsMoreInfo(!missing.isEmpty())
                .missingParams(missing)
                .params(new LinkedHashMap<>(params))
                .rawParams(new LinkedHashMap<>(params))
                .response(response)
                .confidence(KEYWORD_CONFIDENCE)
                .source(IntentSourceEnum.KEYWORD)
                .amount(amount)
                .token(token)
                .build();
    }

    private ParsedIntentVO reply(String response) {
        return ParsedIntentVO.builder()
                .response(response)
                .confidence(KEYWORD_CONFIDENCE)
                .source(IntentSourceEnum.KEYWORD)
                .build();
    }

    private FunctionDescriptorVO firstCandidate(FunctionCatalogVO catalog, List<String> candidates) {
        for (String candidate : candidates) {
            FunctionDescriptorVO function = catalog.findIgnoreCase(candidate);
            if (function != null) {
                return function;
            }
        }
        return null;
    }

    private List<AbiParameterVO> inputsOfType(FunctionDescriptorVO function, String type) {
        return function.safeInputs().stream()
                .filter(input -> type.equals(input.getType()))
                .collect(Collectors.toList());
    }

    private String functionNames(FunctionCatalogVO catalog, int limit) {
        return catalog.getFunctions().stream()
                .limit(limit)
                .map(FunctionDescriptorVO::getName)
                .collect(Collectors.joining(", "));
    }

    private boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private record KeywordRule(String keyword, List<String> candidates) {
    }
}
