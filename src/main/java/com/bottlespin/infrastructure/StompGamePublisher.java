package com.bottlespin.infrastructure;

import com.bottlespin.application.port.GamePublisher;
import com.bottlespin.domain.GameBroadcast;
import com.bottlespin.dto.GameEvent;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Delivers game events to individual STOMP sessions.
 *
 * <p>Every event goes to the private queue {@value #EVENTS_DESTINATION} of each addressed
 * session, so a room broadcast can leave out its sender. Room groups hold the sessions that
 * created or joined a room and lose them on disconnect.
 */
@Component
public class StompGamePublisher implements GamePublisher {
  public static final String EVENTS_DESTINATION = "/queue/events";

  private final SimpMessagingTemplate ws;
  private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();
  /** Reverse of {@link #groups}: session id to the rooms it is a member of. */
  private final Map<String, Set<String>> roomsOf = new ConcurrentHashMap<>();

  public StompGamePublisher(SimpMessagingTemplate ws) {
    this.ws = ws;
  }

  @Override
  public void publish(GameBroadcast b) {
    switch (b.audience()) {
      case CONNECTION -> send(b.connectionId(), b.event());
      case ROOM -> members(b.roomCode()).forEach(sid -> send(sid, b.event()));
      case ROOM_EXCEPT_SENDER ->
          members(b.roomCode()).stream()
              .filter(sid -> !sid.equals(b.connectionId()))
              .forEach(sid -> send(sid, b.event()));
    }
  }

  @Override
  public void joinGroup(String roomCode, String connectionId) {
    roomsOf.computeIfAbsent(connectionId, k -> ConcurrentHashMap.newKeySet()).add(roomCode);
    groups.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
  }

  @Override
  public void releaseConnection(String connectionId) {
    Set<String> codes = roomsOf.remove(connectionId);
    if (codes == null) {
      return;
    }
    for (String code : codes) {
      groups.computeIfPresent(
          code,
          (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
          });
    }
  }

  /** Snapshot of the sessions currently in a room group. */
  public Set<String> members(String roomCode) {
    Set<String> members = groups.get(roomCode);
    return members == null ? Set.of() : Set.copyOf(members);
  }

  private void send(String sid, GameEvent event) {
    ws.convertAndSendToUser(sid, EVENTS_DESTINATION, event, headersFor(sid));
  }

  /** Address the user destination by session id; clients have no principal. */
  private static MessageHeaders headersFor(String sid) {
    SimpMessageHeaderAccessor h = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
    h.setSessionId(sid);
    h.setLeaveMutable(true);
    return h.getMessageHeaders();
  }
}
