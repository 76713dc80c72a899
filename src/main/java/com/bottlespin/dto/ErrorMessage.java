package com.bottlespin.dto;

public record ErrorMessage(String event, String code, String message) implements GameEvent {
  public ErrorMessage(String code, String message) {
    this("error", code, message);
  }
}
