package com.bottlespin.application;

import static org.junit.jupiter.api.Assertions.*;

import com.bottlespin.domain.GameRoom;
import com.bottlespin.domain.PlayerId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GameServiceConcurrencyTest {
  private final ExecutorService pool = Executors.newFixedThreadPool(8);
  private final RecordingPublisher publisher = new RecordingPublisher();
  private final ManualScheduling clock = new ManualScheduling();
  private final RoomRegistry rooms = new RoomRegistry(new RoomCodeGenerator(new Random(11), 1000));
  private final SessionIndex sessions = new SessionIndex();
  private final DisconnectReaper reaper =
      new DisconnectReaper(rooms, sessions, publisher, clock, sid -> true, 30_000);
  private final GameService svc =
      new GameService(rooms, sessions, publisher, clock, reaper, new Random(13), 2000);

  @AfterEach
  void tearDown() throws InterruptedException {
    pool.shutdownNow();
    pool.awaitTermination(5, TimeUnit.SECONDS);
  }

  private <T> List<T> runTogether(List<Callable<T>> tasks) throws Exception {
    CountDownLatch go = new CountDownLatch(1);
    List<Future<T>> futures = new ArrayList<>();
    for (Callable<T> t : tasks) {
      futures.add(
          pool.submit(
              () -> {
                go.await();
                return t.call();
              }));
    }
    go.countDown();
    List<T> out = new ArrayList<>();
    for (Future<T> f : futures) {
      out.add(f.get(10, TimeUnit.SECONDS));
    }
    return out;
  }

  @Test
  void concurrentJoins_admitExactlyOneGuest() throws Exception {
    String code = svc.createRoom("host", "Host");
    List<Callable<ActionResult>> joins = new ArrayList<>();
    for (int i = 0; i < 16; i++) {
      String sid = "guest-" + i;
      joins.add(() -> svc.joinRoom(sid, code, sid));
    }

    List<ActionResult> results = runTogether(joins);

    assertEquals(1, results.stream().filter(ActionResult::isApplied).count());
    assertEquals(15, results.stream().filter(r -> r.error() == ErrorCode.ROOM_FULL).count());
    assertEquals(GameRoom.MAX_PLAYERS, rooms.getRoom(code).orElseThrow().snapshot().players().size());
  }

  @Test
  void concurrentCreation_neverSharesACode() throws Exception {
    List<Callable<String>> creates = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      String sid = "c-" + i;
      creates.add(() -> svc.createRoom(sid, sid));
    }

    List<String> codes = runTogether(creates);

    Set<String> unique = new HashSet<>(codes);
    assertEquals(codes.size(), unique.size());
    unique.forEach(c -> assertTrue(rooms.getRoom(c).isPresent(), c));
  }

  @Test
  void racingCompletions_scoreOncePerTurn() throws Exception {
    String code = svc.createRoom("a", "A");
    svc.joinRoom("b", code, "B");
    svc.startGame("a", code);
    List<Callable<ActionResult>> tasks = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      String sid = i % 2 == 0 ? "a" : "b";
      tasks.add(() -> svc.completeChallenge(sid, code));
    }

    List<ActionResult> results = runTogether(tasks);

    long applied = results.stream().filter(ActionResult::isApplied).count();
    Map<PlayerId, Integer> scores = rooms.getRoom(code).orElseThrow().snapshot().scores();
    int total = scores.values().stream().mapToInt(Integer::intValue).sum();
    assertEquals(applied, total);
    assertTrue(Math.abs(scores.get(PlayerId.of("a")) - scores.get(PlayerId.of("b"))) <= 1);
  }
}
