package com.contractmind.trigger.application.command;

import com.contractmind.api.dto.ChatResponseDTO;
import com.contractmind.api.dto.PreparedTransactionDTO;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.agent.service.AgentDirectoryDomainService;
import com.contractmind.domain.chat.adapter.gateway.ITelemetrySink;
import com.contractmind.domain.chat.model.entity.ChatTurnEntity;
import com.contractmind.domain.chat.service.ChatHistoryDomainService;
import com.contractmind.domain.intent.model.valobj.IntentParseContextVO;
import com.contractmind.domain.intent.model.valobj.IntentParserSettingsVO;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;
import com.contractmind.domain.intent.service.IntentParseDomainService;
import com.contractmind.domain.transaction.model.valobj.CoercionSettingsVO;
import com.contractmind.domain.transaction.model.valobj.RoutingContextVO;
import com.contractmind.domain.transaction.model.valobj.TransactionEnvelopeVO;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;
import com.contractmind.domain.transaction.service.ContractTypeDetectorDomainService;
import com.contractmind.domain.transaction.service.ReadQueryDomainService;
import com.contractmind.domain.transaction.service.TransactionRouterDomainService;
import com.contractmind.trigger.application.common.PreparedTransactionAssembler;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ContractTypeEnum;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.TelemetrySchemaEnum;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 聊天管线写用例：消息 → 意图 → 只读查询或未签名交易。
 * <p>
 * 各阶段严格串行。NOT_FOUND / ILLEGAL_PARAMETER 向上抛出交给统一异常处理，
 * 其它意外异常转为通用失败文案，不中断连接。
 * </p>
 */
@Slf4j
@Service
public class ChatPipelineCommandService {

    static final String GENERIC_FAILURE = "Sorry, something went wrong while processing your request. Please try again.";
    static final String INACTIVE_AGENT = "Sorry, this agent is currently inactive.";

    private final AgentDirectoryDomainService agentDirectoryDomainService;
    private final ChatHistoryDomainService chatHistoryDomainService;
    private final IntentParseDomainService intentParseDomainService;
    private final ReadQueryDomainService readQueryDomainService;
    private final CalldataEncoderDomainService calldataEncoderDomainService;
    private final ContractTypeDetectorDomainService contractTypeDetectorDomainService;
    private final TransactionRouterDomainService transactionRouterDomainService;
    private final ITelemetrySink telemetrySink;
    private final CoercionSettingsVO coercionSettings;
    private final IntentParserSettingsVO parserSettings;

    public ChatPipelineCommandService(AgentDirectoryDomainService agentDirectoryDomainService,
                                      ChatHistoryDomainService chatHistoryDomainService,
                                      IntentParseDomainService intentParseDomainService,
                                      ReadQueryDomainService readQueryDomainService,
                                      CalldataEncoderDomainService calldataEncoderDomainService,
                                      ContractTypeDetectorDomainService contractTypeDetectorDomainService,
                                      TransactionRouterDomainService transactionRouterDomainService,
                                      ITelemetrySink telemetrySink,
                                      CoercionSettingsVO coercionSettings,
                                      IntentParserSettingsVO parserSettings) {
        this.agentDirectoryDomainService = agentDirectoryDomainService;
        this.chatHistoryDomainService = chatHistoryDomainService;
        this.intentParseDomainService = intentParseDomainService;
        this.readQueryDomainService = readQueryDomainService;
        this.calldataEncoderDomainService = calldataEncoderDomainService;
        this.contractTypeDetectorDomainService = contractTypeDetectorDomainService;
        this.transactionRouterDomainService = transactionRouterDomainService;
        this.telemetrySink = telemetrySink;
        this.coercionSettings = coercionSettings == null ? CoercionSettingsVO.defaults() : coercionSettings;
        this.parserSettings = parserSettings == null ? IntentParserSettingsVO.defaults() : parserSettings;
    }

    public ChatPipelineResult execute(String agentIdOrName, String message, String userAddress) {
        if (StringUtils.isBlank(agentIdOrName)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "agentId is required");
        }
        if (StringUtils.isBlank(message)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "message is required");
        }
        if (userAddress == null || !userAddress.trim().matches(Constants.ADDRESS_REGEX)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userAddress must be a 0x-prefixed 40 hex address");
        }
        String caller = userAddress.trim();
        AgentEntity agent = agentDirectoryDomainService.requireAgent(agentIdOrName);
        long start = System.currentTimeMillis();
        try {
            return runPipeline(agent, message.trim(), caller, start);
        } catch (AppException ex) {
            if (ex.is(ResponseCode.NOT_FOUND) || ex.is(ResponseCode.ILLEGAL_PARAMETER)) {
                throw ex;
            }
            log.error("CHAT_PIPELINE_FAILED agentId={}, code={}, error={}", agent.getAgentId(), ex.getCode(), ex.getInfo(), ex);
            return ChatPipelineResult.textOnly(null, GENERIC_FAILURE);
        } catch (Exception ex) {
            log.error("CHAT_PIPELINE_FAILED agentId={}, error={}", agent.getAgentId(), ex.getMessage(), ex);
            return ChatPipelineResult.textOnly(null, GENERIC_FAILURE);
        }
    }

    private ChatPipelineResult runPipeline(AgentEntity agent, String message, String caller, long start) {
        String agentId = agent.getAgentId();
        if (!agent.isActiveAgent()) {
            chatHistoryDomainService.append(ChatTurnEntity.userTurn(agentId, caller, message));
            chatHistoryDomainService.append(ChatTurnEntity.assistantTurn(agentId, caller, INACTIVE_AGENT, null, false));
            return ChatPipelineResult.textOnly(null, INACTIVE_AGENT);
        }
        FunctionCatalogVO catalog = agentDirectoryDomainService.loadCatalog(agent);
        List<ChatTurnEntity> recentTurns = chatHistoryDomainService.recentTurns(agentId, caller, historyWindow());

        ParsedIntentVO intent = intentParseDomainService.parse(IntentParseContextVO.builder()
                .message(message)
                .userAddress(caller)
                .agentName(agent.getName())
                .catalog(catalog)
                .recentTurns(recentTurns)
                .build());

        ChatTurnEntity userTurn = ChatTurnEntity.userTurn(agentId, caller, message);
        userTurn.setFunctionName(intent.getFunctionName());
        userTurn.setRequiresTransaction(intent.isRequiresTransaction());
        chatHistoryDomainService.append(userTurn);

        ChatResponseDTO response = respond(agent, catalog, intent, caller);
        chatHistoryDomainService.append(ChatTurnEntity.assistantTurn(agentId, caller, response.getResponse(),
                intent.getFunctionName(), Boolean.TRUE.equals(response.getIsPreparedTransaction())));

        publishExecution(agent, intent, response, caller);
        log.info("CHAT_PIPELINE_DONE agentId={}, function={}, source={}, prepared={}, route={}, costMs={}",
                agentId,
                intent.getFunctionName(),
                intent.getSource(),
                response.getIsPreparedTransaction(),
                response.getPreparedTransaction() == null ? "-" : response.getPreparedTransaction().getRoute(),
                System.currentTimeMillis() - start);
        return new ChatPipelineResult(intent, response);
    }

    private ChatResponseDTO respond(AgentEntity agent, FunctionCatalogVO catalog, ParsedIntentVO intent, String caller) {
        if (!intent.hasFunction()) {
            return text(StringUtils.defaultIfBlank(intent.getResponse(), "Query processed"));
        }
        FunctionDescriptorVO function = catalog.find(intent.getFunctionName());
        if (!intent.isRequiresTransaction()) {
            return text(readQueryDomainService.query(function.getName(), agent.getTargetAddress(), caller,
                    function, intent.getParams()));
        }
        if (intent.isNeedsMoreInfo()) {
            return text(missingParamsMessage(function, intent.getMissingParams()));
        }

        String calldata;
        try {
            calldata = calldataEncoderDomainService.encodeByName(function, intent.getParams());
        } catch (AppException ex) {
            if (!ex.is(ResponseCode.ABI_ENCODING_ERROR)) {
                throw ex;
            }
            log.warn("CALLDATA_ENCODING_FAILED agentId={}, function={}, error={}",
                    agent.getAgentId(), function.getName(), ex.getInfo());
            return text("Error preparing transaction: " + ex.getInfo());
        }

        ContractTypeEnum contractType = contractTypeDetectorDomainService.detect(agent.getTargetAddress());
        RoutingContextVO routingContext = RoutingContextVO.builder()
                .agentId(agent.getAgentId())
                .action(TransactionRouterDomainService.deriveAction(function.getName()))
                .protocol(agent.getName())
                .amount(intent.getAmount())
                .token(intent.getToken())
                .build();
        TransactionEnvelopeVO envelope = transactionRouterDomainService.route(function.getName(),
                agent.getTargetAddress(), calldata, caller, contractType, routingContext);

        PreparedTransactionDTO prepared = PreparedTransactionAssembler.toDTO(envelope, intent.getParams());
        ChatResponseDTO response = new ChatResponseDTO();
        response.setResponse(preparedMessage(function, intent));
        response.setIsPreparedTransaction(true);
        response.setPreparedTransaction(prepared);
        return response;
    }

    String missingParamsMessage(FunctionDescriptorVO function, List<String> missingParams) {
        Map<String, String> types = new LinkedHashMap<>();
        for (AbiParameterVO input : function.safeInputs()) {
            types.put(input.getName(), input.getType());
        }
        String described = missingParams.stream()
                .map(name -> types.containsKey(name) ? name + " (" + types.get(name) + ")" : name)
                .collect(Collectors.joining(", "));
        return "I need the following parameters to proceed: " + described + ". Could you provide them?";
    }

    private String preparedMessage(FunctionDescriptorVO function, ParsedIntentVO intent) {
        String name = function.getName();
        if ("mint".equals(name) || "transfer".equals(name)) {
            int decimals = coercionSettings.resolveDecimals(name, intent.getToken());
            Object amount = displayValue(intent.getParams().get("amount"), decimals);
            Object to = intent.getParams().get("to");
            return "✅ Transaction prepared! Ready to " + name + " "
                    + (amount == null ? "tokens" : amount) + " to " + (to == null ? "address" : to)
                    + ". Please review and sign.";
        }
        return "✅ Transaction prepared! Ready to call " + name + ". Please review and sign.";
    }

    private Object displayValue(Object value, int decimals) {
        if (value instanceof BigInteger raw) {
            BigDecimal tokens = new BigDecimal(raw).movePointLeft(decimals);
            return String.format(Locale.ROOT, "%.2f tokens", tokens);
        }
        return value;
    }

    private void publishExecution(AgentEntity agent, ParsedIntentVO intent, ChatResponseDTO response, String caller) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("agentId", agent.getAgentId());
        record.put("userAddress", caller);
        record.put("functionName", intent.getFunctionName());
        record.put("source", intent.getSource() == null ? null : intent.getSource().name());
        record.put("confidence", intent.getConfidence());
        record.put("prepared", response.getIsPreparedTransaction());
        if (response.getPreparedTransaction() != null) {
            record.put("route", response.getPreparedTransaction().getRoute());
        }
        telemetrySink.publish(TelemetrySchemaEnum.AGENT_EXECUTION, record);
    }

    private int historyWindow() {
        Integer window = parserSettings.getHistoryWindow();
        return window == null ? IntentParserSettingsVO.defaults().getHistoryWindow() : Math.max(window, 0);
    }

    private ChatResponseDTO text(String message) {
        ChatResponseDTO response = new ChatResponseDTO();
        response.setResponse(message);
        response.setIsPreparedTransaction(false);
        return response;
    }

    /**
     * 管线输出：解析出的意图（失败兜底时为 null）与返回给客户端的响应。
     */
    public record ChatPipelineResult(ParsedIntentVO intent, ChatResponseDTO response) {

        static ChatPipelineResult textOnly(ParsedIntentVO intent, String message) {
            ChatResponseDTO response = new ChatResponseDTO();
            response.setResponse(message);
            response.setIsPreparedTransaction(false);
            return new ChatPipelineResult(intent, response);
        }
    }
}
