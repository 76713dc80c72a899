package com.bottlespin.dto;

import java.util.List;

public record PlayerJoinedMessage(String event, String playerName, List<PlayerView> players)
    implements GameEvent {
  public PlayerJoinedMessage(String playerName, List<PlayerView> players) {
    this("player_joined", playerName, players);
  }
}
