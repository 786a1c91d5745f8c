package com.contractmind.domain.intent.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.IntentParserSettingsVO;
import com.contractmind.types.enums.MessageRoleEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 意图解析提示词构建。
 */
@Service
public class IntentPromptDomainService {

    private final IntentParserSettingsVO settings;

    public IntentPromptDomainService(IntentParserSettingsVO settings) {
        this.settings = settings == null ? IntentParserSettingsVO.defaults() : settings;
    }

    public String buildSystemPrompt(IntentParseContextVO context) {
        String agentName = StringUtils.defaultIfBlank(context.getAgentName(), "ContractMind Agent");
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(agentName).append(", a friendly AI assistant for a smart contract.\n\n");
        prompt.append("Your role:\n");
        prompt.append("1. Handle greetings and casual conversation naturally\n");
        prompt.append("2. Answer questions about the contract\n");
        prompt.append("3. Map user requests to contract functions when appropriate\n");
        prompt.append("4. Extract function parameters from the user's message\n");
        prompt.append("5. Ask for missing required parameters conversationally\n");
        prompt.append("6. Keep the conversation context: if you asked for parameters, continue with the same function\n\n");
        prompt.append("Available contract functions:\n");
        prompt.append(renderCatalog(context.safeCatalog())).append('\n');
        String history = renderHistory(context.getRecentTurns());
        if (!history.isEmpty()) {
            prompt.append('\n').append(history);
        }
        prompt.append("\nRules:\n");
        prompt.append("- Only suggest functions that are authorized (✅) and explain when a function is not authorized (❌)\n");
        prompt.append("- If parameters are missing, set needsMoreInfo=true and list them in missingParams\n");
        prompt.append("- If ALL required parameters are provided, do not ask for confirmation\n");
        prompt.append("- For view/pure functions no transaction is needed; other functions require a transaction\n");
        prompt.append("- Address parameters: \"me\", \"my\", \"I\", \"myself\" mean the user's address\n");
        prompt.append("- Amount parameters: return the plain decimal number as a string (e.g. \"ten\" -> \"10\"); ");
        prompt.append("the backend converts it to base units\n\n");
        prompt.append("Respond with JSON only:\n");
        prompt.append("{\n");
        prompt.append("  \"functionName\": \"function name or null\",\n");
        prompt.append("  \"requiresTransaction\": true/false,\n");
        prompt.append("  \"response\": \"your natural response message\",\n");
        prompt.append("  \"params\": {\"param1\": \"actual value\"},\n");
        prompt.append("  \"needsMoreInfo\": false,\n");
        prompt.append("  \"missingParams\": [\"param1\"],\n");
        prompt.append("  \"confidence\": 0.0-1.0\n");
        prompt.append("}");
        return prompt.toString();
    }

    public String buildUserPrompt(IntentParseContextVO context) {
        return "User message: " + context.getMessage() + "\nUser address: " + context.getUserAddress();
    }

    /**
     * 每个函数一行：{@code - name(p: type, ...) [mutability] ✅ authorized}
     */
    public String renderCatalog(FunctionCatalogVO catalog) {
        return catalog.getFunctions().stream()
                .map(this::renderFunction)
                .collect(Collectors.joining("\n"));
    }

    String renderFunction(FunctionDescriptorVO function) {
        String inputs = function.safeInputs().stream()
                .map(this::renderParameter)
                .collect(Collectors.joining(", "));
        String mutability = function.getStateMutability() == null ? "nonpayable" : function.getStateMutability().getCode();
        return "- " + function.getName() + "(" + inputs + ") [" + mutability + "] "
                + (function.isAuthorized() ? "✅ authorized" : "❌ not authorized");
    }

    private String renderParameter(AbiParameterVO parameter) {
        return parameter.getName() + ": " + parameter.getType();
    }

    private String renderHistory(List<ChatTurnEntity> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        int window = settings.getHistoryWindow() == null ? 4 : Math.max(settings.getHistoryWindow(), 0);
        List<ChatTurnEntity> tail = turns.subList(Math.max(turns.size() - window, 0), turns.size());
        if (tail.isEmpty()) {
            return "";
        }
        StringBuilder history = new StringBuilder("Recent conversation:\n");
        for (ChatTurnEntity turn : tail) {
            MessageRoleEnum role = turn.getRole() == null ? MessageRoleEnum.USER : turn.getRole();
            history.append(role.getLabel()).append(": ").append(turn.getMessage()).append('\n');
        }
        history.append("\nIf the user is answering your previous question, keep the previous intent and use the new information to complete it.\n");
        return history.toString();
    }
}
