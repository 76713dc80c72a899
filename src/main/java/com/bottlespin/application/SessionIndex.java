package com.bottlespin.application;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Connection id to the code of the room the connection last created or joined. */
@Component
public class SessionIndex {
  private final Map<String, String> sessionRoom = new ConcurrentHashMap<>();

  public void bind(String connectionId, String roomCode) {
    sessionRoom.put(connectionId, roomCode);
  }

  public Optional<String> lookup(String connectionId) {
    return Optional.ofNullable(sessionRoom.get(connectionId));
  }

  /** Drop the binding and return the room it pointed to, if any. */
  public Optional<String> unbind(String connectionId) {
    return Optional.ofNullable(sessionRoom.remove(connectionId));
  }

}
