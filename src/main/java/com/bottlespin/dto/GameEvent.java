package com.bottlespin.dto;

/**
 * Server-to-client notification. {@code event} names the message; {@code type} is left free
 * because challenge payloads use it for the challenge kind.
 */
public interface GameEvent {
  String event();
}
