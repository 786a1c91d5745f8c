package com.contractmind.trigger.websocket;

import com.contractmind.api.dto.ChatSocketEventDTO;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按用户地址维护 WebSocket 连接，支持同一用户多连接推送。
 * <p>
 * 单连接发送失败只记录日志并移除该连接，不影响其它连接。
 * </p>
 */
@Slf4j
@Component
public class WebSocketSessionRegistry {

    private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, Set<WebSocketSession>> sessionsByUser = new ConcurrentHashMap<>();
    private final Map<String, WebSocketSession> decoratedById = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final int maxConnectionsPerUser;

    public WebSocketSessionRegistry(ObjectMapper objectMapper,
                                    @Value("${contractmind.websocket.max-connections-per-user:3}") int maxConnectionsPerUser) {
        this.objectMapper = objectMapper;
        this.maxConnectionsPerUser = Math.max(1, maxConnectionsPerUser);
    }

    /**
     * 注册连接，超出单用户上限返回 false。
     */
    public boolean subscribe(String userAddress, WebSocketSession session) {
        String key = key(userAddress);
        if (key == null || session == null) {
            return false;
        }
        AtomicBoolean accepted = new AtomicBoolean(false);
        // 计数、加入与空集合清理都在同一个 compute 中完成
        sessionsByUser.compute(key, (k, existing) -> {
            Set<WebSocketSession> sessions = existing == null ? ConcurrentHashMap.newKeySet() : existing;
            if (sessions.size() >= maxConnectionsPerUser) {
                log.warn("WS_CONNECTION_REJECTED user={}, open={}, max={}", k, sessions.size(), maxConnectionsPerUser);
                return existing;
            }
            WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session,
                    SEND_TIME_LIMIT_MILLIS, BUFFER_SIZE_LIMIT);
            decoratedById.put(session.getId(), decorated);
            sessions.add(decorated);
            accepted.set(true);
            return sessions;
        });
        if (accepted.get()) {
            log.info("WS_CONNECTED user={}, sessionId={}", key, session.getId());
        }
        return accepted.get();
    }

    public void unsubscribe(String userAddress, WebSocketSession session) {
        String key = key(userAddress);
        if (key == null || session == null) {
            return;
        }
        WebSocketSession decorated = decoratedById.remove(session.getId());
        removeFromUser(key, decorated == null ? session : decorated);
        log.info("WS_DISCONNECTED user={}, sessionId={}", key, session.getId());
    }

    /**
     * 向指定用户的全部连接推送事件，返回成功送达的连接数。
     */
    public int publish(String userAddress, ChatSocketEventDTO event) {
        String key = key(userAddress);
        Set<WebSocketSession> sessions = key == null ? null : sessionsByUser.get(key);
        if (sessions == null || sessions.isEmpty() || event == null) {
            return 0;
        }
        TextMessage payload;
        try {
            payload = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException ex) {
            log.warn("WS_EVENT_SERIALIZE_FAILED user={}, type={}, error={}", key, event.getType(), ex.getMessage());
            return 0;
        }
        int delivered = 0;
        for (WebSocketSession session : sessions) {
            if (send(key, session, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * 直接回复到某个连接（已注册时走并发安全的装饰器）。
     */
    public boolean reply(WebSocketSession session, ChatSocketEventDTO event) {
        WebSocketSession target = decoratedById.getOrDefault(session.getId(), session);
        try {
            return send(null, target, new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (JsonProcessingException ex) {
            log.warn("WS_EVENT_SERIALIZE_FAILED sessionId={}, type={}, error={}", session.getId(), event.getType(), ex.getMessage());
            return false;
        }
    }

    public int connectionCount(String userAddress) {
        String key = key(userAddress);
        Set<WebSocketSession> sessions = key == null ? null : sessionsByUser.get(key);
        return sessions == null ? 0 : sessions.size();
    }

    private boolean send(String key, WebSocketSession session, TextMessage payload) {
        if (!session.isOpen()) {
            drop(key, session);
            return false;
        }
        try {
            session.sendMessage(payload);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("WS_SEND_FAILED user={}, sessionId={}, error={}", key, session.getId(), ex.getMessage());
            drop(key, session);
            closeQuietly(session);
            return false;
        }
    }

    private void drop(String key, WebSocketSession session) {
        decoratedById.remove(session.getId());
        if (key == null) {
            sessionsByUser.keySet().forEach(userKey -> removeFromUser(userKey, session));
            return;
        }
        removeFromUser(key, session);
    }

    private void removeFromUser(String key, WebSocketSession session) {
        sessionsByUser.computeIfPresent(key, (k, sessions) -> {
            sessions.remove(session);
            return sessions.isEmpty() ? null : sessions;
        });
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException | RuntimeException ex) {
            log.debug("WS_CLOSE_FAILED sessionId={}, error={}", session.getId(), ex.getMessage());
        }
    }

    private String key(String userAddress) {
        return StringUtils.isBlank(userAddress) ? null : userAddress.trim().toLowerCase(Locale.ROOT);
    }
}
