package com.bottlespin.dto;

public record PlayerDisconnectedMessage(String event, String playerName) implements GameEvent {
  public PlayerDisconnectedMessage(String playerName) {
    this("player_disconnected", playerName);
  }
}
