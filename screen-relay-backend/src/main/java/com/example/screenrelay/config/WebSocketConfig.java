package com.example.screenrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

import java.util.Arrays;

/**
 * STOMP endpoint for the signaling protocol. Clients send to {@code /app/<message>} and
 * subscribe to {@code /user/queue/events}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    @Value("${relay.websocket.endpoint:/ws}")
    private String websocketEndpoint;

    @Value("${relay.allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
        // frames for one session go out in the order they were produced
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        log.info("STOMP endpoint {} (allowed origins: {})", websocketEndpoint, Arrays.toString(allowedOrigins));
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
        registry.addEndpoint(websocketEndpoint + "/sockjs")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
        registry.setPreserveReceiveOrder(true);
    }
}
