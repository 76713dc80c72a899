package com.bottlespin.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over SockJS at {@value #ENDPOINT}.
 *
 * <p>Clients send game actions to {@code /app/*} and subscribe to
 * {@code /user/queue/events}. There are no shared topics: every event is addressed to single
 * sessions by {@link StompGamePublisher}, so the simple broker only serves {@code /queue}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
  public static final String ENDPOINT = "/ws";
  static final String QUEUE_PREFIX = "/queue";

  private final String[] allowedOrigins;

  public WebSocketConfig(@Value("${bottlespin.allowed-origins:*}") String allowedOrigins) {
    this.allowedOrigins = allowedOrigins.trim().split("\\s*,\\s*");
  }

  @Override
  public void configureMessageBroker(MessageBrokerRegistry r) {
    r.enableSimpleBroker(QUEUE_PREFIX);
    r.setApplicationDestinationPrefixes("/app");
    r.setUserDestinationPrefix("/user");
  }

  @Override
  public void registerStompEndpoints(StompEndpointRegistry r) {
    r.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins).withSockJS();
  }
}
