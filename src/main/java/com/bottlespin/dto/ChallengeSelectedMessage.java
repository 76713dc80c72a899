package com.bottlespin.dto;

public record ChallengeSelectedMessage(
    String event, String type, String challenge, String playerName, String playerId)
    implements GameEvent {
  public ChallengeSelectedMessage(String type, String challenge, String playerName, String playerId) {
    this("challenge_selected", type, challenge, playerName, playerId);
  }
}
