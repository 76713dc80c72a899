package com.bottlespin.dto;

public record RoomCreatedMessage(String event, String roomCode) implements GameEvent {
  public RoomCreatedMessage(String roomCode) {
    this("room_created", roomCode);
  }
}
