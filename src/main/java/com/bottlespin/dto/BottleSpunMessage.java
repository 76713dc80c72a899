package com.bottlespin.dto;

public record BottleSpunMessage(String event, int rotation, String winner) implements GameEvent {
  public BottleSpunMessage(int rotation, String winner) {
    this("bottle_spun", rotation, winner);
  }
}
