package com.p2pchat.signaling.config;

import com.p2pchat.signaling.websocket.SignalingWebSocketHandler;
import com.p2pchat.signaling.websocket.TokenHandshakeInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 핸들러와 핸드셰이크 인터셉터를 등록하는 설정 클래스.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
    private final SignalingProperties properties;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler,
            TokenHandshakeInterceptor tokenHandshakeInterceptor, SignalingProperties properties) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
        this.tokenHandshakeInterceptor = tokenHandshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // /ws 는 join 메시지로, /ws/{room} 은 연결 직후 자동으로 방에 참가한다.
        registry.addHandler(signalingWebSocketHandler, "/ws", "/ws/*")
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }

    /**
     * 컨테이너 버퍼는 최대 메시지 크기의 4배. 그 사이 크기의 프레임은 핸들러가 payload-too-large로 거절한다.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize((int) properties.getMaxMessageSize().toBytes() * 4);
        container.setMaxSessionIdleTimeout(properties.getIdleTimeout().multipliedBy(2).toMillis());
        return container;
    }
}
