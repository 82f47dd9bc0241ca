package com.phillippitts.commandrouter.config;

import com.phillippitts.commandrouter.config.properties.ChannelProperties;
import com.phillippitts.commandrouter.service.channel.CommandWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the realtime command channel at {@value #ENDPOINT}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws";

    private final CommandWebSocketHandler handler;
    private final ChannelProperties properties;

    public WebSocketConfig(CommandWebSocketHandler handler, ChannelProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT)
                .setAllowedOriginPatterns(properties.getAllowedOriginPattern());
    }
}
