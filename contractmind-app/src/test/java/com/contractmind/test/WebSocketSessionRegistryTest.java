package com.contractmind.test;

import com.contractmind.api.dto.ChatSocketEventDTO;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.trigger.websocket.WebSocketSessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WebSocketSessionRegistryTest {

    private WebSocketSessionRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new WebSocketSessionRegistry(new ObjectMapper(), 2);
    }

    @Test
    public void shouldLimitConnectionsPerUser() {
        Assertions.assertTrue(registry.subscribe(ContractFixtures.USER, session("s1")));
        Assertions.assertTrue(registry.subscribe(ContractFixtures.USER.toUpperCase().replace("0X", "0x"), session("s2")));
        Assertions.assertFalse(registry.subscribe(ContractFixtures.USER, session("s3")));

        Assertions.assertEquals(2, registry.connectionCount(ContractFixtures.USER));
    }

    @Test
    public void shouldPushEventToEveryConnection() throws Exception {
        WebSocketSession first = session("s1");
        WebSocketSession second = session("s2");
        registry.subscribe(ContractFixtures.USER, first);
        registry.subscribe(ContractFixtures.USER, second);
        ChatSocketEventDTO event = ChatSocketEventDTO.of("transaction_result", "done");
        event.setTxHash("0xabc");

        int delivered = registry.publish(ContractFixtures.USER, event);

        Assertions.assertEquals(2, delivered);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(first).sendMessage(captor.capture());
        String payload = ((TextMessage) captor.getValue()).getPayload();
        Assertions.assertTrue(payload.contains("\"type\":\"transaction_result\""));
        Assertions.assertTrue(payload.contains("\"tx_hash\":\"0xabc\""));
        Assertions.assertFalse(payload.contains("block_number"));
    }

    @Test
    public void shouldDropConnectionWhenSendFails() throws Exception {
        WebSocketSession broken = session("broken");
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        WebSocketSession healthy = session("healthy");
        registry.subscribe(ContractFixtures.USER, broken);
        registry.subscribe(ContractFixtures.USER, healthy);

        int delivered = registry.publish(ContractFixtures.USER, ChatSocketEventDTO.of("response", "hi"));

        Assertions.assertEquals(1, delivered);
        Assertions.assertEquals(1, registry.connectionCount(ContractFixtures.USER));
        verify(broken).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    public void shouldForgetUnsubscribedSession() {
        WebSocketSession session = session("s1");
        registry.subscribe(ContractFixtures.USER, session);

        registry.unsubscribe(ContractFixtures.USER, session);

        Assertions.assertEquals(0, registry.connectionCount(ContractFixtures.USER));
        Assertions.assertEquals(0, registry.publish(ContractFixtures.USER, ChatSocketEventDTO.of("response", "hi")));
    }

    @Test
    public void shouldKeepNewSessionWhenLastOldSessionLeavesConcurrently() throws Exception {
        WebSocketSession old = session("old");
        registry.subscribe(ContractFixtures.USER, old);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WebSocketSession fresh = mock(WebSocketSession.class);
        when(fresh.isOpen()).thenReturn(true);
        when(fresh.getId()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "fresh";
        });

        Thread connecting = new Thread(() -> registry.subscribe(ContractFixtures.USER, fresh));
        connecting.start();
        Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));
        Thread leaving = new Thread(() -> registry.unsubscribe(ContractFixtures.USER, old));
        leaving.start();
        Thread.sleep(100);
        release.countDown();
        connecting.join(5000);
        leaving.join(5000);

        Assertions.assertEquals(1, registry.connectionCount(ContractFixtures.USER));
        Assertions.assertEquals(1, registry.publish(ContractFixtures.USER, ChatSocketEventDTO.of("response", "hi")));
        verify(fresh).sendMessage(any());
    }

    private WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
