package com.bottlespin.application;

import static com.bottlespin.domain.GameBroadcast.toConnection;
import static com.bottlespin.domain.GameBroadcast.toRoom;
import static com.bottlespin.domain.GameBroadcast.toRoomExcept;

import com.bottlespin.application.port.GamePublisher;
import com.bottlespin.application.port.TaskScheduling;
import com.bottlespin.domain.Challenge;
import com.bottlespin.domain.GameBroadcast;
import com.bottlespin.domain.GameRoom;
import com.bottlespin.domain.Player;
import com.bottlespin.domain.PlayerId;
import com.bottlespin.domain.Snapshot;
import com.bottlespin.dto.BottleSpunMessage;
import com.bottlespin.dto.ChallengeCompletedMessage;
import com.bottlespin.dto.ChallengeSelectedMessage;
import com.bottlespin.dto.ChallengeSkippedMessage;
import com.bottlespin.dto.ErrorMessage;
import com.bottlespin.dto.GameStartedMessage;
import com.bottlespin.dto.JoinedRoomMessage;
import com.bottlespin.dto.PlayerJoinedMessage;
import com.bottlespin.dto.PlayerView;
import com.bottlespin.dto.RoomCreatedMessage;
import com.bottlespin.dto.TurnChangedMessage;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Core game orchestration service.
 *
 * <p>Responsibilities:
 * - Create/join rooms and manage membership
 * - Start games and pick the first turn
 * - Spin the bottle, select, complete and skip challenges, keep scores
 * - Publish real-time updates to clients
 *
 * <p>Per-room operations are guarded by the {@link java.util.concurrent.locks.ReentrantLock} of
 * {@link GameRoom}. Public methods look the room up, lock it, validate and update state, build the
 * outgoing {@link GameBroadcast}s, then publish them via {@link GamePublisher} after releasing the
 * lock.
 *
 * <p>Only joining reports errors to the client. Turn and phase violations (not the host, not your
 * turn, game not started, unknown room or not a member) are dropped silently and return
 * {@link ActionResult#ignored()}.
 */
@Service
public class GameService {
  static final int BASE_ROTATION = 1440;

  private final Logger log = LoggerFactory.getLogger(getClass());

  private final RoomRegistry rooms;
  private final SessionIndex sessions;
  private final GamePublisher publisher;
  private final TaskScheduling scheduler;
  private final DisconnectReaper reaper;
  private final Random rnd;
  private final Duration turnChangeDelay;

  public GameService(
      RoomRegistry rooms,
      SessionIndex sessions,
      GamePublisher publisher,
      TaskScheduling scheduler,
      DisconnectReaper reaper,
      @Qualifier("gameRandom") Random rnd,
      @Value("${bottlespin.turn-change-delay-ms:2000}") long turnChangeDelayMs) {
    this.rooms = rooms;
    this.sessions = sessions;
    this.publisher = publisher;
    this.scheduler = scheduler;
    this.reaper = reaper;
    this.rnd = rnd;
    this.turnChangeDelay = Duration.ofMillis(turnChangeDelayMs);
  }

  /**
   * Create a new room and register the calling connection as host.
   *
   * <p>The room is visible to other threads before the creator is bound to it. If the creator's
   * connection closed in that window its disconnect went unseen, so it is handed to the reaper
   * here.
   *
   * @param sid connection id of the creator
   * @param playerName display name, taken as is
   * @return the new room code
   * @throws IllegalStateException if no free room code could be allocated
   */
  public String createRoom(String sid, String playerName) {
    GameRoom room = rooms.createRoom(sid, playerName);
    String code = room.code();
    sessions.bind(sid, code);
    publisher.joinGroup(code, sid);
    publisher.publish(toConnection(sid, new RoomCreatedMessage(code)));
    log.info("Created room {} host '{}'", code, playerName);
    reaper.recheck(sid);
    return code;
  }

  /**
   * Join an existing room as the second player.
   *
   * <p>Checks run in order: unknown room, room full, game already started. Each failure is sent
   * to the caller as an error and leaves the room untouched, also when the caller is already a
   * member. A member re-joining a room that still has a free seat gets the player list again.
   *
   * @param sid connection id
   * @param roomCode room code (case-insensitive)
   * @param playerName display name, taken as is
   */
  public ActionResult joinRoom(String sid, String roomCode, String playerName) {
    String code = RoomRegistry.normalize(roomCode);
    Optional<GameRoom> found = rooms.getRoom(code);
    if (found.isEmpty()) {
      return reject(sid, code, ErrorCode.ROOM_NOT_FOUND);
    }
    GameRoom room = found.get();

    List<GameBroadcast> toPublish;
    room.lock().lock();
    try {
      if (room.closed()) {
        return reject(sid, code, ErrorCode.ROOM_NOT_FOUND);
      }
      if (room.full()) {
        return reject(sid, code, ErrorCode.ROOM_FULL);
      }
      if (room.started()) {
        return reject(sid, code, ErrorCode.GAME_STARTED);
      }
      if (room.playerByConnection(sid).isPresent()) {
        JoinedRoomMessage again =
            new JoinedRoomMessage(code, PlayerView.ofAll(room.snapshot().players()));
        toPublish = List.of(toConnection(sid, again));
      } else {
        room.addPlayer(new Player(PlayerId.of(sid), sid, playerName, false));
        sessions.bind(sid, code);
        publisher.joinGroup(code, sid);

        List<PlayerView> players = PlayerView.ofAll(room.snapshot().players());
        toPublish =
            List.of(
                toConnection(sid, new JoinedRoomMessage(code, players)),
                toRoomExcept(code, sid, new PlayerJoinedMessage(playerName, players)));
        log.info("'{}' joined room {}", playerName, code);
      }
    } finally {
      room.lock().unlock();
    }

    toPublish.forEach(publisher::publish);
    return ActionResult.applied();
  }

  /**
   * Start the game, or restart it with fresh scores and a new first turn. Only the host of a full
   * room may do so.
   */
  public ActionResult startGame(String sid, String roomCode) {
    return apply(
        sid,
        roomCode,
        "startGame",
        (room, caller) -> {
          if (!caller.id().equals(room.host().id())
              || room.players().size() != GameRoom.MAX_PLAYERS) {
            return List.of();
          }
          PlayerId first = pickPlayer(room);
          room.start(first);
          log.info("Game started in room {}, first turn {}", room.code(), first);
          GameStartedMessage started =
              new GameStartedMessage(first.value(), wireScores(room.snapshot()));
          return List.of(toRoom(room.code(), started));
        });
  }

  /**
   * Spin the bottle. The winner is drawn independently of who spun, so the turn may stay with the
   * spinner or pass to the other player.
   */
  public ActionResult spinBottle(String sid, String roomCode) {
    return apply(
        sid,
        roomCode,
        "spinBottle",
        (room, caller) -> {
          if (!room.isTurnOf(caller.id())) {
            return List.of();
          }
          int rotation = BASE_ROTATION + rnd.nextInt(360);
          PlayerId winner = pickPlayer(room);
          room.currentTurn(winner);
          room.clearChallenge();
          log.info("Bottle spun in room {}, winner {}", room.code(), winner);
          return List.of(toRoom(room.code(), new BottleSpunMessage(rotation, winner.value())));
        });
  }

  public ActionResult selectChallenge(String sid, String roomCode, String type, String text) {
    return apply(
        sid,
        roomCode,
        "selectChallenge",
        (room, caller) -> {
          if (!room.isTurnOf(caller.id())) {
            return List.of();
          }
          room.challenge(new Challenge(type, text, caller.id()));
          log.info("Challenge '{}' selected in room {}", type, room.code());
          return List.of(
              toRoom(
                  room.code(),
                  new ChallengeSelectedMessage(type, text, caller.name(), caller.id().value())));
        });
  }

  /**
   * Score a point for the turn holder and pass the turn. The turn switches right away; the
   * {@code turn_changed} notification follows after the configured delay.
   */
  public ActionResult completeChallenge(String sid, String roomCode) {
    return apply(
        sid,
        roomCode,
        "completeChallenge",
        (room, caller) -> {
          if (!room.isTurnOf(caller.id())) {
            return List.of();
          }
          room.incrementScore(caller.id());
          GameBroadcast completed =
              toRoom(
                  room.code(),
                  new ChallengeCompletedMessage(
                      caller.id().value(), caller.name(), wireScores(room.snapshot())));
          passTurn(room, caller);
          log.info("Challenge completed by '{}' in room {}", caller.name(), room.code());
          return List.of(completed);
        });
  }

  /** Pass the turn without scoring; same delayed notification as {@link #completeChallenge}. */
  public ActionResult skipChallenge(String sid, String roomCode) {
    return apply(
        sid,
        roomCode,
        "skipChallenge",
        (room, caller) -> {
          if (!room.isTurnOf(caller.id())) {
            return List.of();
          }
          GameBroadcast skipped =
              toRoom(room.code(), new ChallengeSkippedMessage(caller.id().value(), caller.name()));
          passTurn(room, caller);
          log.info("Challenge skipped by '{}' in room {}", caller.name(), room.code());
          return List.of(skipped);
        });
  }

  // Helpers

  @FunctionalInterface
  private interface RoomAction {
    /** Runs under the room lock; an empty result means the request is ignored. */
    List<GameBroadcast> apply(GameRoom room, Player caller);
  }

  /** Look up the room and the calling member, run the action under the room lock, publish. */
  private ActionResult apply(String sid, String roomCode, String op, RoomAction action) {
    Optional<GameRoom> found = rooms.getRoom(roomCode);
    if (found.isEmpty()) {
      log.debug("{} from {} ignored: unknown room {}", op, sid, roomCode);
      return ActionResult.ignored();
    }
    GameRoom room = found.get();

    List<GameBroadcast> toPublish;
    room.lock().lock();
    try {
      if (room.closed()) {
        log.debug("{} from {} ignored: room {} closed", op, sid, room.code());
        return ActionResult.ignored();
      }
      Optional<Player> caller = room.playerByConnection(sid);
      if (caller.isEmpty()) {
        log.debug("{} from {} ignored: not a member of room {}", op, sid, room.code());
        return ActionResult.ignored();
      }
      toPublish = action.apply(room, caller.get());
    } finally {
      room.lock().unlock();
    }

    if (toPublish.isEmpty()) {
      log.debug("{} from {} ignored in room {}", op, sid, room.code());
      return ActionResult.ignored();
    }
    toPublish.forEach(publisher::publish);
    return ActionResult.applied();
  }

  private ActionResult reject(String sid, String code, ErrorCode error) {
    log.debug("Join of room {} by {} rejected: {}", code, sid, error);
    publisher.publish(toConnection(sid, new ErrorMessage(error.name(), error.message())));
    return ActionResult.rejected(error);
  }

  /** Uniform choice over the current members. */
  private PlayerId pickPlayer(GameRoom room) {
    List<Player> players = room.players();
    return players.get(rnd.nextInt(players.size())).id();
  }

  /** Hand the turn to the other player, clear the challenge and announce it later. */
  private void passTurn(GameRoom room, Player caller) {
    room.currentTurn(room.otherPlayer(caller.id()).id());
    room.clearChallenge();
    String code = room.code();
    scheduler.schedule(() -> announceTurn(code), turnChangeDelay);
  }

  /** Deferred {@code turn_changed}; skipped if the room has been removed meanwhile. */
  void announceTurn(String code) {
    Optional<GameRoom> found = rooms.getRoom(code);
    if (found.isEmpty()) {
      log.debug("Turn change for room {} skipped: room removed", code);
      return;
    }
    GameRoom room = found.get();
    GameBroadcast b;
    room.lock().lock();
    try {
      if (room.closed()) {
        log.debug("Turn change for room {} skipped: room closed", code);
        return;
      }
      b = toRoom(code, new TurnChangedMessage(room.snapshot().currentTurn().value()));
    } finally {
      room.lock().unlock();
    }
    publisher.publish(b);
  }

  private static Map<String, Integer> wireScores(Snapshot state) {
    Map<String, Integer> out = new LinkedHashMap<>();
    state.scores().forEach((id, score) -> out.put(id.value(), score));
    return out;
  }
}
