package com.contractmind.trigger.websocket;

import com.contractmind.api.dto.ChatResponseDTO;
import com.contractmind.api.dto.ChatSocketEventDTO;
import com.contractmind.domain.chat.model.valobj.TransactionOutcomeVO;
import com.contractmind.domain.chat.service.TransactionResultDomainService;
import com.contractmind.domain.intent.model.valobj.ParsedIntentVO;
import com.contractmind.trigger.application.command.ChatPipelineCommandService;
import com.contractmind.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 实时聊天通道 {@code /ws/chat/{userAddress}}。
 * <p>
 * 客户端消息：chat / transaction_sent / ping。管线在公共线程池上执行，不阻塞 IO 线程。
 * </p>
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    public static final String EVENT_THINKING = "thinking";
    public static final String EVENT_INTENT_PARSED = "intent_parsed";
    public static final String EVENT_TRANSACTION_READY = "transaction_ready";
    public static final String EVENT_RESPONSE = "response";
    public static final String EVENT_TRANSACTION_MONITORING = "transaction_monitoring";
    public static final String EVENT_TRANSACTION_CONFIRMED = "transaction_confirmed";
    public static final String EVENT_PONG = "pong";
    public static final String EVENT_ERROR = "error";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final WebSocketSessionRegistry sessionRegistry;
    private final ChatPipelineCommandService chatPipelineCommandService;
    private final TransactionResultDomainService transactionResultDomainService;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public ChatWebSocketHandler(WebSocketSessionRegistry sessionRegistry,
                                ChatPipelineCommandService chatPipelineCommandService,
                                TransactionResultDomainService transactionResultDomainService,
                                ObjectMapper objectMapper,
                                @Qualifier("commonThreadPoolExecutor") Executor executor) {
        this.sessionRegistry = sessionRegistry;
        this.chatPipelineCommandService = chatPipelineCommandService;
        this.transactionResultDomainService = transactionResultDomainService;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String userAddress = userAddress(session);
        if (!sessionRegistry.subscribe(userAddress, session)) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Too many connections"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(message.getPayload(), MAP_TYPE);
        } catch (JsonProcessingException ex) {
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: invalid message format"));
            return;
        }
        String type = stringValue(payload.get("type"));
        if ("chat".equals(type)) {
            handleChat(session, payload);
        } else if ("transaction_sent".equals(type)) {
            handleTransactionSent(session, payload);
        } else if ("ping".equals(type)) {
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_PONG, null));
        } else {
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: unsupported message type " + type));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WS_TRANSPORT_ERROR sessionId={}, error={}", session.getId(), exception.getMessage());
        sessionRegistry.unsubscribe(userAddress(session), session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionRegistry.unsubscribe(userAddress(session), session);
    }

    private void handleChat(WebSocketSession session, Map<String, Object> payload) {
        String userAddress = userAddress(session);
        String agentId = StringUtils.defaultIfBlank(stringValue(payload.get("agentId")),
                stringValue(session.getAttributes().get(UserAddressHandshakeInterceptor.ATTR_AGENT_ID)));
        String text = stringValue(payload.get("message"));
        if (StringUtils.isBlank(agentId) || StringUtils.isBlank(text)) {
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: agentId and message are required"));
            return;
        }
        session.getAttributes().put(UserAddressHandshakeInterceptor.ATTR_AGENT_ID, agentId);
        sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_THINKING, "Processing your request..."));
        submit(session, () -> {
            try {
                ChatPipelineCommandService.ChatPipelineResult result = chatPipelineCommandService.execute(agentId, text, userAddress);
                if (result.intent() != null) {
                    ChatSocketEventDTO parsed = ChatSocketEventDTO.of(EVENT_INTENT_PARSED, null);
                    parsed.setIntent(intentView(result.intent()));
                    sessionRegistry.reply(session, parsed);
                }
                sessionRegistry.reply(session, responseEvent(result.response()));
            } catch (AppException ex) {
                sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: " + ex.getInfo()));
            } catch (Exception ex) {
                log.error("WS_CHAT_FAILED sessionId={}, agentId={}, error={}", session.getId(), agentId, ex.getMessage(), ex);
                sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: " + ex.getMessage()));
            }
        });
    }

    private void handleTransactionSent(WebSocketSession session, Map<String, Object> payload) {
        String txHash = StringUtils.defaultIfBlank(stringValue(payload.get("tx_hash")), stringValue(payload.get("txHash")));
        if (StringUtils.isBlank(txHash)) {
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: tx_hash is required"));
            return;
        }
        ChatSocketEventDTO monitoring = ChatSocketEventDTO.of(EVENT_TRANSACTION_MONITORING, "Monitoring transaction...");
        monitoring.setTxHash(txHash);
        sessionRegistry.reply(session, monitoring);

        String userAddress = userAddress(session);
        String agentId = stringValue(session.getAttributes().get(UserAddressHandshakeInterceptor.ATTR_AGENT_ID));
        String functionName = stringValue(payload.get("functionName"));
        submit(session, () -> {
            try {
                TransactionOutcomeVO outcome = transactionResultDomainService.confirm(txHash, userAddress, agentId, functionName);
                if (outcome.isPending()) {
                    return;
                }
                ChatSocketEventDTO confirmed = ChatSocketEventDTO.of(EVENT_TRANSACTION_CONFIRMED, outcome.getMessage());
                confirmed.setTxHash(txHash);
                confirmed.setBlockNumber(outcome.getBlockNumber());
                confirmed.setStatus(outcome.getStatus());
                sessionRegistry.publish(userAddress, confirmed);
            } catch (AppException ex) {
                log.warn("WS_TX_MONITOR_FAILED txHash={}, code={}, error={}", txHash, ex.getCode(), ex.getInfo());
                sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: " + ex.getInfo()));
            } catch (Exception ex) {
                log.error("WS_TX_MONITOR_FAILED txHash={}, error={}", txHash, ex.getMessage(), ex);
                sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: " + ex.getMessage()));
            }
        });
    }

    private void submit(WebSocketSession session, Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.warn("WS_TASK_REJECTED sessionId={}, error={}", session.getId(), ex.getMessage());
            sessionRegistry.reply(session, ChatSocketEventDTO.of(EVENT_ERROR, "Error: server is busy, please retry"));
        }
    }

    private ChatSocketEventDTO responseEvent(ChatResponseDTO response) {
        if (Boolean.TRUE.equals(response.getIsPreparedTransaction()) && response.getPreparedTransaction() != null) {
            ChatSocketEventDTO ready = ChatSocketEventDTO.of(EVENT_TRANSACTION_READY, response.getResponse());
            ready.setTransaction(response.getPreparedTransaction());
            return ready;
        }
        return ChatSocketEventDTO.of(EVENT_RESPONSE, response.getResponse());
    }

    static Map<String, Object> intentView(ParsedIntentVO intent) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("functionName", intent.getFunctionName());
        view.put("requiresTransaction", intent.isRequiresTransaction());
        view.put("needsMoreInfo", intent.isNeedsMoreInfo());
        view.put("confidence", intent.getConfidence());
        view.put("source", intent.getSource() == null ? null : intent.getSource().name());
        Map<String, Object> params = new LinkedHashMap<>();
        intent.getParams().forEach((key, value) -> params.put(key, value instanceof BigInteger ? value.toString() : value));
        view.put("params", params);
        view.put("missingParams", intent.getMissingParams());
        if (intent.getAmount() != null) {
            view.put("amount", intent.getAmount());
        }
        if (intent.getToken() != null) {
            view.put("token", intent.getToken());
        }
        return view;
    }

    private String userAddress(WebSocketSession session) {
        return stringValue(session.getAttributes().get(UserAddressHandshakeInterceptor.ATTR_USER_ADDRESS));
    }

    private String stringValue(Object value) {
        return value == null ? null : String.valueOf(value).trim();
    }
}
