package com.contractmind.config;

import com.contractmind.trigger.websocket.ChatWebSocketHandler;
import com.contractmind.trigger.websocket.UserAddressHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 端点注册：{@code /ws/chat/{userAddress}}。
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final UserAddressHandshakeInterceptor handshakeInterceptor;

    @Value("${cors.allowed-origin-patterns:http://localhost:3000,http://127.0.0.1:3000}")
    private String[] allowedOriginPatterns;

    public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler,
                           UserAddressHandshakeInterceptor handshakeInterceptor) {
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, "/ws/chat/*")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(allowedOriginPatterns);
    }
}
