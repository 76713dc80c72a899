package com.bottlespin.dto;

public record ChallengeSkippedMessage(String event, String playerId, String playerName)
    implements GameEvent {
  public ChallengeSkippedMessage(String playerId, String playerName) {
    this("challenge_skipped", playerId, playerName);
  }
}
