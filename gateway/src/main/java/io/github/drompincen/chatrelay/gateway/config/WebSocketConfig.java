package io.github.drompincen.chatrelay.gateway.config;

import io.github.drompincen.chatrelay.gateway.websocket.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler handler;

    public WebSocketConfig(ChatWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws").setAllowedOrigins("*");
    }

    @Bean
    ServletServerContainerFactoryBean createWebSocketContainer(
            @Value("${chatrelay.connection.max-frame-size:1MB}") DataSize maxFrameSize) {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize((int) maxFrameSize.toBytes());
        return container;
    }
}
