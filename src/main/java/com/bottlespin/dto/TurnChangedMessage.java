package com.bottlespin.dto;

public record TurnChangedMessage(String event, String currentTurn) implements GameEvent {
  public TurnChangedMessage(String currentTurn) {
    this("turn_changed", currentTurn);
  }
}
