package com.bottlespin.application;

/** Failures reported back to the requesting connection. */
public enum ErrorCode {
  ROOM_NOT_FOUND("Room not found"),
  ROOM_FULL("Room is full"),
  GAME_STARTED("Game already started");

  private final String message;

  ErrorCode(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
