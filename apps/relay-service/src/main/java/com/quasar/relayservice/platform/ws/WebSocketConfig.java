package com.quasar.relayservice.platform.ws;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * 原生 WebSocket 端点配置（不走 STOMP，线协议是自定义的 JSON 消息）。
 *
 * - 端点：/ws，viewer 和 source 共用，连接时通过 ?role=game 区分；
 * - 允许任意来源（浏览器页面与 relay 可能不同源）。
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayWebSocketHandler relayWebSocketHandler;

    @Value("${quasar.ws.path:/ws}")
    private String path;

    @Value("${quasar.ws.max-text-message-bytes:65536}")
    private int maxTextMessageBytes;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler, path)
                .setAllowedOriginPatterns("*");
    }

    /**
     * 帧里带整屏文本，默认 8K 的消息缓冲不够
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageBytes);
        return container;
    }
}
