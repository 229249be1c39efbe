package com.example.signaling.config;

import com.example.signaling.handler.SignalingWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 설정
 *
 * <p>엔드포인트: {@code signaling.websocket.path} (기본값 /) - 채팅/통화 시그널링 (JSON)</p>
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingHandler;

    @Value("${signaling.websocket.path:/}")
    private String path;

    @Value("${signaling.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${signaling.websocket.max-message-bytes:1048576}")
    private int maxMessageBytes;

    public WebSocketConfig(SignalingWebSocketHandler signalingHandler) {
        this.signalingHandler = signalingHandler;
    }

    /**
     * WebSocket 메시지 버퍼 크기 설정 (SDP 메시지가 클 수 있음)
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxMessageBytes);
        container.setMaxBinaryMessageBufferSize(maxMessageBytes);
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingHandler, path)
                .setAllowedOrigins(allowedOrigins);
    }
}
