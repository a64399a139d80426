package com.bmsedge.parking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.StompWebSocketEndpointRegistration;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for the shift dashboards. Statistics go out on
 * {@code /topic/shifts/{id}/statistics}, lifecycle events on {@code /topic/shifts}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${parking.websocket.endpoint:/ws-parking}")
    private String endpoint;

    @Value("${parking.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // Gate terminals connect natively, browser dashboards may need SockJS
        dashboardEndpoint(registry);
        dashboardEndpoint(registry).withSockJS();
    }

    private StompWebSocketEndpointRegistration dashboardEndpoint(StompEndpointRegistry registry) {
        return registry.addEndpoint(endpoint).setAllowedOriginPatterns(allowedOrigins);
    }
}
