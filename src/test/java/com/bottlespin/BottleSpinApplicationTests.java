package com.bottlespin;

import static org.junit.jupiter.api.Assertions.*;

import com.bottlespin.application.ActionResult;
import com.bottlespin.application.GameService;
import com.bottlespin.application.RoomRegistry;
import com.bottlespin.application.SessionIndex;
import com.bottlespin.application.port.ConnectionLiveness;
import com.bottlespin.infrastructure.StompGamePublisher;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class BottleSpinApplicationTests {

  @Autowired GameService game;
  @Autowired RoomRegistry rooms;
  @Autowired SessionIndex sessions;
  @Autowired StompGamePublisher publisher;
  @Autowired ConnectionLiveness liveness;

  @Test
  void contextWiresGameOntoStomp() {
    String code = game.createRoom("ctx-a", "Alice");
    ActionResult joined = game.joinRoom("ctx-b", code, "Bob");

    assertTrue(joined.isApplied());
    assertEquals(2, rooms.getRoom(code).orElseThrow().players().size());
    assertTrue(publisher.members(code).containsAll(Set.of("ctx-a", "ctx-b")));
    assertFalse(liveness.isConnected("ctx-a"));
    // no STOMP session behind "ctx-a", so the creator was handed to the reaper at once
    assertTrue(sessions.lookup("ctx-a").isEmpty());
    assertEquals(code, sessions.lookup("ctx-b").orElseThrow());
  }
}
