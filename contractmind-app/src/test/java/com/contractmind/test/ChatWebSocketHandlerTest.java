package com.contractmind.test;

import com.contractmind.domain.chat.service.TransactionResultDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.trigger.application.command.ChatPipelineCommandService;
import com.contractmind.trigger.websocket.ChatWebSocketHandler;
import com.contractmind.trigger.websocket.UserAddressHandshakeInterceptor;
import com.contractmind.trigger.websocket.WebSocketSessionRegistry;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ChatWebSocketHandlerTest {

    private TransactionResultDomainService transactionResultDomainService;
    private ChatWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    public void setUp() {
        transactionResultDomainService = mock(TransactionResultDomainService.class);
        handler = new ChatWebSocketHandler(new WebSocketSessionRegistry(new ObjectMapper(), 3),
                mock(ChatPipelineCommandService.class), transactionResultDomainService, new ObjectMapper(), Runnable::run);

        Map<String, Object> attributes = new HashMap<>();
        attributes.put(UserAddressHandshakeInterceptor.ATTR_USER_ADDRESS, ContractFixtures.USER);
        attributes.put(UserAddressHandshakeInterceptor.ATTR_AGENT_ID, ContractFixtures.AGENT_ID);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
    }

    @Test
    public void shouldReportUnexpectedMonitoringFailureToClient() throws Exception {
        when(transactionResultDomainService.confirm(eq("0xabc"), eq(ContractFixtures.USER), eq(ContractFixtures.AGENT_ID), any()))
                .thenThrow(new IllegalStateException("receipt decode failed"));

        handler.handleMessage(session, new TextMessage("{\"type\":\"transaction_sent\",\"tx_hash\":\"0xabc\"}"));

        List<String> sent = sentPayloads();
        Assertions.assertEquals(2, sent.size());
        Assertions.assertTrue(sent.get(0).contains("\"type\":\"transaction_monitoring\""));
        Assertions.assertTrue(sent.get(1).contains("\"type\":\"error\""));
        Assertions.assertTrue(sent.get(1).contains("receipt decode failed"));
    }

    @Test
    public void shouldReportRpcFailureWhileMonitoring() throws Exception {
        when(transactionResultDomainService.confirm(anyString(), anyString(), any(), any()))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "node unreachable"));

        handler.handleMessage(session, new TextMessage("{\"type\":\"transaction_sent\",\"tx_hash\":\"0xabc\"}"));

        List<String> sent = sentPayloads();
        Assertions.assertTrue(sent.get(sent.size() - 1).contains("\"type\":\"error\""));
        Assertions.assertTrue(sent.get(sent.size() - 1).contains("node unreachable"));
    }

    @Test
    public void shouldAnswerPing() throws Exception {
        handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        Assertions.assertTrue(sentPayloads().get(0).contains("\"type\":\"pong\""));
    }

    private List<String> sentPayloads() throws Exception {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(message -> ((TextMessage) message).getPayload())
                .collect(Collectors.toList());
    }
}
