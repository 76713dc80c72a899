package com.bottlespin.application;

import com.bottlespin.domain.GameRoom;
import com.bottlespin.domain.Player;
import com.bottlespin.domain.PlayerId;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * All live rooms keyed by code.
 *
 * <p>Lookups are lock-free. Mutation of a room happens under that room's own lock, so rooms never
 * block each other. A deleted room is marked closed so that callers still holding a reference can
 * tell it is gone once they acquire its lock.
 */
@Component
public class RoomRegistry {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, GameRoom> rooms = new ConcurrentHashMap<>();
  private final RoomCodeGenerator codes;

  public RoomRegistry(RoomCodeGenerator codes) {
    this.codes = codes;
  }

  /**
   * Allocate a fresh code and register a room hosted by the given connection.
   *
   * @throws IllegalStateException if the code space is exhausted
   */
  public GameRoom createRoom(String connectionId, String playerName) {
    Player host = new Player(PlayerId.of(connectionId), connectionId, playerName, true);
    String code = codes.generate(c -> rooms.putIfAbsent(c, new GameRoom(c, host)) == null);
    return rooms.get(code);
  }

  public Optional<GameRoom> getRoom(String code) {
    String key = normalize(code);
    return key == null ? Optional.empty() : Optional.ofNullable(rooms.get(key));
  }

  /** Remove the room and mark it closed. Returns false if it was already gone. */
  public boolean deleteRoom(String code) {
    String key = normalize(code);
    GameRoom room = key == null ? null : rooms.remove(key);
    if (room == null) return false;
    room.lock().lock();
    try {
      room.close();
    } finally {
      room.lock().unlock();
    }
    log.info("Room {} removed.", key);
    return true;
  }

  /** Trim and upper-case a client supplied code. */
  public static String normalize(String code) {
    if (code == null) return null;
    String n = code.trim().toUpperCase(Locale.ROOT);
    return n.isEmpty() ? null : n;
  }
}
