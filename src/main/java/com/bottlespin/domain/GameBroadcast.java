package com.bottlespin.domain;

import com.bottlespin.dto.GameEvent;

/**
 * One outbound notification together with its addressing mode.
 *
 * <p>Broadcasts are assembled while the room lock is held and handed to the publisher after it is
 * released.
 */
public record GameBroadcast(Audience audience, String roomCode, String connectionId, GameEvent event) {

  public enum Audience {
    /** Only the originating connection. */
    CONNECTION,
    /** Every connection in the room except the originating one. */
    ROOM_EXCEPT_SENDER,
    /** Every connection in the room. */
    ROOM
  }

  public static GameBroadcast toConnection(String connectionId, GameEvent event) {
    return new GameBroadcast(Audience.CONNECTION, null, connectionId, event);
  }

  public static GameBroadcast toRoomExcept(String roomCode, String senderId, GameEvent event) {
    return new GameBroadcast(Audience.ROOM_EXCEPT_SENDER, roomCode, senderId, event);
  }

  public static GameBroadcast toRoom(String roomCode, GameEvent event) {
    return new GameBroadcast(Audience.ROOM, roomCode, null, event);
  }
}
