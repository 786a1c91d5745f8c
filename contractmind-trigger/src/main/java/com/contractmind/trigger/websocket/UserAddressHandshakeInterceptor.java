package com.contractmind.trigger.websocket;

import com.contractmind.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * 握手阶段从 {@code /ws/chat/{userAddress}} 解析用户地址并写入会话属性，非法地址直接拒绝。
 */
@Slf4j
@Component
public class UserAddressHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_USER_ADDRESS = "userAddress";
    public static final String ATTR_AGENT_ID = "agentId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String path = request.getURI().getPath();
        String userAddress = path == null ? null : path.substring(path.lastIndexOf('/') + 1);
        if (userAddress == null || !userAddress.matches(Constants.ADDRESS_REGEX)) {
            log.warn("WS_HANDSHAKE_REJECTED path={}", path);
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(ATTR_USER_ADDRESS, userAddress);
        String agentId = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(ATTR_AGENT_ID);
        if (agentId != null && !agentId.isBlank()) {
            attributes.put(ATTR_AGENT_ID, agentId.trim());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        // no-op
    }
}
