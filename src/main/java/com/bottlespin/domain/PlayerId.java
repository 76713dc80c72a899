package com.bottlespin.domain;

import java.util.Objects;

/**
 * Identity of a player within a room.
 *
 * <p>Kept apart from the transport's connection id. For now the mapping is 1:1: a player's id is
 * derived from the connection that created or joined the room and lives as long as it.
 */
public record PlayerId(String value) {
  public PlayerId {
    Objects.requireNonNull(value, "value");
  }

  public static PlayerId of(String connectionId) {
    return new PlayerId(connectionId);
  }

  @Override
  public String toString() {
    return value;
  }
}
