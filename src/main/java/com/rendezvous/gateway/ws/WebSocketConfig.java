package com.rendezvous.gateway.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RendezvousWebSocketHandler handler;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(RendezvousWebSocketHandler handler,
                           @Value("${rendezvous.ws.path:/v1}") String path,
                           @Value("${rendezvous.ws.allowed-origins:*}") String[] allowedOrigins) {
        this.handler = handler;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path).setAllowedOrigins(allowedOrigins);
    }

    // message bodies are hex, so a frame is roughly twice its payload
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer(
            @Value("${rendezvous.ws.max-text-message-size:131072}") int maxTextMessageSize) {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        return container;
    }
}
