package com.bottlespin.dto;

import java.util.Map;

public record ChallengeCompletedMessage(
    String event, String playerId, String playerName, Map<String, Integer> scores)
    implements GameEvent {
  public ChallengeCompletedMessage(String playerId, String playerName, Map<String, Integer> scores) {
    this("challenge_completed", playerId, playerName, scores);
  }
}
