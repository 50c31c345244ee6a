package io.github.drompincen.acpbridge.gateway.config;

import io.github.drompincen.acpbridge.gateway.websocket.AcpBridgeWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AcpBridgeWebSocketHandler handler;
    private final String[] allowedOrigins;

    public WebSocketConfig(AcpBridgeWebSocketHandler handler,
                           @Value("${acpbridge.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.handler = handler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws").setAllowedOrigins(allowedOrigins);
    }
}
