package com.bottlespin.application;

import static com.bottlespin.domain.GameBroadcast.toRoom;

import com.bottlespin.application.port.ConnectionLiveness;
import com.bottlespin.application.port.GamePublisher;
import com.bottlespin.application.port.ScheduledTask;
import com.bottlespin.application.port.TaskScheduling;
import com.bottlespin.domain.GameBroadcast;
import com.bottlespin.domain.GameRoom;
import com.bottlespin.dto.PlayerDisconnectedMessage;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Removes rooms that nobody is connected to any more.
 *
 * <p>A disconnect is announced to the room at once. The room itself is only checked after a grace
 * period and deleted if none of its players still has a live connection. Only the check belonging
 * to the room's most recent disconnect acts, so a room is never removed sooner than one grace
 * period after its last player left.
 */
@Component
public class DisconnectReaper {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final RoomRegistry rooms;
  private final SessionIndex sessions;
  private final GamePublisher publisher;
  private final TaskScheduling scheduler;
  private final ConnectionLiveness liveness;
  private final Duration grace;
  /** Room code to the sequence number of its latest disconnect. */
  private final Map<String, Long> lastDisconnect = new ConcurrentHashMap<>();

  public DisconnectReaper(
      RoomRegistry rooms,
      SessionIndex sessions,
      GamePublisher publisher,
      TaskScheduling scheduler,
      ConnectionLiveness liveness,
      @Value("${bottlespin.disconnect-grace-ms:30000}") long graceMs) {
    this.rooms = rooms;
    this.sessions = sessions;
    this.publisher = publisher;
    this.scheduler = scheduler;
    this.liveness = liveness;
    this.grace = Duration.ofMillis(graceMs);
  }

  /**
   * Handle a closed connection.
   *
   * @param connectionId id of the connection that went away
   * @return the pending room check, or empty if the connection was not in a live room
   */
  public Optional<ScheduledTask> onDisconnect(String connectionId) {
    Optional<String> bound = sessions.unbind(connectionId);
    if (bound.isEmpty()) {
      return Optional.empty();
    }
    String code = bound.get();
    Optional<GameRoom> found = rooms.getRoom(code);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    GameRoom room = found.get();

    GameBroadcast b = null;
    room.lock().lock();
    try {
      if (!room.closed()) {
        b =
            room.playerByConnection(connectionId)
                .map(p -> toRoom(code, new PlayerDisconnectedMessage(p.name())))
                .orElse(null);
      }
    } finally {
      room.lock().unlock();
    }
    if (b != null) {
      publisher.publish(b);
      log.info("Player of connection {} disconnected from room {}", connectionId, code);
    }

    long seq = lastDisconnect.merge(code, 1L, Long::sum);
    return Optional.of(scheduler.schedule(() -> reap(code, seq), grace));
  }

  /**
   * Treat {@code connectionId} as disconnected if it is no longer live. Used after binding a
   * connection to a room, for closes that were handled before the binding existed.
   *
   * @return the pending room check, or empty if the connection is live or was not bound
   */
  public Optional<ScheduledTask> recheck(String connectionId) {
    if (liveness.isConnected(connectionId)) {
      return Optional.empty();
    }
    log.debug("Connection {} closed while it was being bound, running disconnect", connectionId);
    return onDisconnect(connectionId);
  }

  /** Delete the room if it still exists and none of its players is connected. */
  void reap(String code, long seq) {
    Optional<GameRoom> found = rooms.getRoom(code);
    if (found.isEmpty()) {
      lastDisconnect.remove(code);
      return;
    }
    GameRoom room = found.get();
    room.lock().lock();
    try {
      if (room.closed()) {
        return;
      }
      if (lastDisconnect.getOrDefault(code, seq) != seq) {
        log.debug("Check #{} of room {} superseded by a later disconnect", seq, code);
        return;
      }
      long connected =
          room.players().stream().filter(p -> liveness.isConnected(p.connectionId())).count();
      if (connected == 0) {
        log.info("Room {} abandoned, removing", code);
        rooms.deleteRoom(code);
        lastDisconnect.remove(code);
      } else {
        log.debug("Room {} kept: {} player(s) still connected", code, connected);
      }
    } finally {
      room.lock().unlock();
    }
  }
}
