package com.bottlespin.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class GameRoomTest {
  private static final PlayerId A = PlayerId.of("a");
  private static final PlayerId B = PlayerId.of("b");

  private GameRoom twoPlayerRoom() {
    GameRoom r = new GameRoom("ABCDEF", new Player(A, "a", "Alice", true));
    r.addPlayer(new Player(B, "b", "Bob", false));
    return r;
  }

  @Test
  void constructor_requiresHost() {
    assertThrows(IllegalArgumentException.class, () -> new GameRoom("X", new Player(A, "a", "Alice", false)));
  }

  @Test
  void addPlayer_enforcesCapacityAndSingleHost() {
    GameRoom r = new GameRoom("ABCDEF", new Player(A, "a", "Alice", true));
    assertThrows(IllegalArgumentException.class, () -> r.addPlayer(new Player(B, "b", "Bob", true)));

    r.addPlayer(new Player(B, "b", "Bob", false));
    assertTrue(r.full());
    assertThrows(IllegalStateException.class, () -> r.addPlayer(new Player(PlayerId.of("c"), "c", "Carol", false)));
    assertEquals("Alice", r.host().name());
  }

  @Test
  void start_givesEveryPlayerZero() {
    GameRoom r = twoPlayerRoom();
    assertTrue(r.scores().isEmpty());

    r.start(B);

    assertTrue(r.started());
    assertEquals(B, r.currentTurn());
    assertEquals(Map.of(A, 0, B, 0), r.scores());
    assertTrue(r.isTurnOf(B));
    assertFalse(r.isTurnOf(A));
  }

  @Test
  void start_again_resetsScoresAndChallenge() {
    GameRoom r = twoPlayerRoom();
    r.start(A);
    r.incrementScore(A);
    r.incrementScore(B);
    r.challenge(new Challenge("dare", "Dance", A));

    r.start(B);

    assertEquals(Map.of(A, 0, B, 0), r.scores());
    assertNull(r.challenge());
    assertTrue(r.isTurnOf(B));
  }

  @Test
  void currentTurn_mustBeAMember() {
    GameRoom r = twoPlayerRoom();
    assertThrows(IllegalArgumentException.class, () -> r.currentTurn(PlayerId.of("zed")));
  }

  @Test
  void otherPlayer_isTheRemainingMember() {
    GameRoom r = twoPlayerRoom();
    assertEquals(B, r.otherPlayer(A).id());
    assertEquals(A, r.otherPlayer(B).id());
  }

  @Test
  void incrementScore_treatsMissingAsZero() {
    GameRoom r = twoPlayerRoom();
    assertEquals(1, r.incrementScore(A));
    assertEquals(2, r.incrementScore(A));
  }

  @Test
  void snapshot_isDetachedFromLaterChanges() {
    GameRoom r = twoPlayerRoom();
    r.start(A);
    Snapshot s = r.snapshot();

    r.incrementScore(A);
    r.challenge(new Challenge("truth", "Q", A));

    assertEquals(0, s.scores().get(A));
    assertNull(s.challenge());
    assertThrows(UnsupportedOperationException.class, () -> s.players().clear());
  }
}
