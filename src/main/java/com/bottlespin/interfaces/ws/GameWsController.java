package com.bottlespin.interfaces.ws;

import com.bottlespin.application.DisconnectReaper;
import com.bottlespin.application.GameService;
import com.bottlespin.dto.CreateRoomRequest;
import com.bottlespin.dto.JoinRoomRequest;
import com.bottlespin.dto.RoomRequest;
import com.bottlespin.dto.SelectChallengeRequest;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * STOMP entry points. Replies and broadcasts are published by the game services; nothing is
 * returned from here.
 */
@Validated
@Controller
public class GameWsController {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final GameService game;
  private final DisconnectReaper reaper;

  public GameWsController(GameService game, DisconnectReaper reaper) {
    this.game = game;
    this.reaper = reaper;
  }

  @MessageMapping("/createRoom")
  public void create(CreateRoomRequest req, @Header("simpSessionId") String sid) {
    game.createRoom(sid, req.playerName());
  }

  @MessageMapping("/joinRoom")
  public void join(JoinRoomRequest req, @Header("simpSessionId") String sid) {
    game.joinRoom(sid, req.roomCode(), req.playerName());
  }

  @MessageMapping("/startGame")
  public void start(@Valid RoomRequest req, @Header("simpSessionId") String sid) {
    game.startGame(sid, req.roomCode());
  }

  @MessageMapping("/spinBottle")
  public void spin(@Valid RoomRequest req, @Header("simpSessionId") String sid) {
    game.spinBottle(sid, req.roomCode());
  }

  @MessageMapping("/selectChallenge")
  public void select(@Valid SelectChallengeRequest req, @Header("simpSessionId") String sid) {
    game.selectChallenge(sid, req.roomCode(), req.type(), req.challenge());
  }

  @MessageMapping("/completeChallenge")
  public void complete(@Valid RoomRequest req, @Header("simpSessionId") String sid) {
    game.completeChallenge(sid, req.roomCode());
  }

  @MessageMapping("/skipChallenge")
  public void skip(@Valid RoomRequest req, @Header("simpSessionId") String sid) {
    game.skipChallenge(sid, req.roomCode());
  }

  /** Malformed turn requests are dropped like any other invalid turn action. */
  @MessageExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
  public void onInvalid(Exception e) {
    log.debug("Invalid request ignored: {}", e.getMessage());
  }

  /** Internal failures end the request; the client is not told. */
  @MessageExceptionHandler(Exception.class)
  public void onError(Exception e) {
    log.error("Request failed", e);
  }

  @EventListener
  public void onDisconnect(SessionDisconnectEvent e) {
    reaper.onDisconnect(e.getSessionId());
  }
}
