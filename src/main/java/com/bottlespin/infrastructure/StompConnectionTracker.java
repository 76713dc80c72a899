package com.bottlespin.infrastructure;

import com.bottlespin.application.port.ConnectionLiveness;
import com.bottlespin.application.port.GamePublisher;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Tracks which STOMP sessions are currently connected.
 *
 * <p>Runs before other disconnect listeners so that a closed session is no longer live and has
 * left every room group by the time the game reacts to it.
 */
@Component
public class StompConnectionTracker implements ConnectionLiveness {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Set<String> live = ConcurrentHashMap.newKeySet();
  private final GamePublisher publisher;

  public StompConnectionTracker(GamePublisher publisher) {
    this.publisher = publisher;
  }

  @EventListener
  public void onConnected(SessionConnectedEvent e) {
    String sid = SimpMessageHeaderAccessor.getSessionId(e.getMessage().getHeaders());
    if (sid == null) return;
    live.add(sid);
    log.info("Client connected: {}", sid);
  }

  @EventListener
  @Order(Ordered.HIGHEST_PRECEDENCE)
  public void onDisconnect(SessionDisconnectEvent e) {
    String sid = e.getSessionId();
    if (live.remove(sid)) {
      log.info("Client disconnected: {}", sid);
    }
    publisher.releaseConnection(sid);
  }

  @Override
  public boolean isConnected(String connectionId) {
    return live.contains(connectionId);
  }
}
