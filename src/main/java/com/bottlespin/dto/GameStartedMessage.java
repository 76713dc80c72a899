package com.bottlespin.dto;

import java.util.Map;

public record GameStartedMessage(String event, String currentTurn, Map<String, Integer> scores)
    implements GameEvent {
  public GameStartedMessage(String currentTurn, Map<String, Integer> scores) {
    this("game_started", currentTurn, scores);
  }
}
