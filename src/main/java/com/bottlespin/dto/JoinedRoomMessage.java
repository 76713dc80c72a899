package com.bottlespin.dto;

import java.util.List;

public record JoinedRoomMessage(String event, String roomCode, List<PlayerView> players)
    implements GameEvent {
  public JoinedRoomMessage(String roomCode, List<PlayerView> players) {
    this("joined_room", roomCode, players);
  }
}
