package com.phillippitts.scriberelay.config;

import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.relay.RelayWebSocketHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the dictation relay endpoint.
 *
 * <p>All origins pass the handshake; {@link com.phillippitts.scriberelay.relay.RelaySession}
 * applies {@code relay.allowed-origins} itself and closes with 4003.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final RelayWebSocketHandler handler;
    private final RelayProperties props;

    public WebSocketConfig(RelayWebSocketHandler handler, RelayProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getPath()).setAllowedOriginPatterns("*");
        LOG.info("Relay WebSocket endpoint registered at {}", props.getPath());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(props.getMaxBinaryMessageBytes());
        container.setMaxTextMessageBufferSize(64 * 1024);
        return container;
    }
}
