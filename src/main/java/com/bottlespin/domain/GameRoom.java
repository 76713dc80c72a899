package com.bottlespin.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one game room.
 *
 * <p>Not thread-safe on its own: callers hold {@link #lock()} around every read-modify-write.
 * Players are kept in join order; the first one is the host.
 */
public class GameRoom {
  public static final int MAX_PLAYERS = 2;

  private final String code;
  private final List<Player> players = new ArrayList<>(MAX_PLAYERS);
  private final Map<PlayerId, Integer> scores = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  private boolean started = false;
  private PlayerId currentTurn;
  private Challenge challenge;
  private boolean closed = false;

  public GameRoom(String code, Player host) {
    if (!host.host()) {
      throw new IllegalArgumentException("First player must be the host");
    }
    this.code = code;
    this.players.add(host);
  }

  public String code() {
    return code;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public List<Player> players() {
    return Collections.unmodifiableList(players);
  }

  public boolean full() {
    return players.size() >= MAX_PLAYERS;
  }

  public void addPlayer(Player p) {
    if (full()) {
      throw new IllegalStateException("Room full");
    }
    if (p.host()) {
      throw new IllegalArgumentException("Room " + code + " already has a host");
    }
    players.add(p);
  }

  public Optional<Player> player(PlayerId id) {
    return players.stream().filter(p -> p.id().equals(id)).findFirst();
  }

  public Optional<Player> playerByConnection(String connectionId) {
    return players.stream().filter(p -> p.connectionId().equals(connectionId)).findFirst();
  }

  public Player host() {
    return players.get(0);
  }

  /**
   * The unique member whose id differs from {@code id}. Only meaningful while rooms hold at most
   * two players.
   */
  public Player otherPlayer(PlayerId id) {
    return players.stream()
        .filter(p -> !p.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("No other player in room " + code));
  }

  public boolean started() {
    return started;
  }

  /**
   * Mark the game as started and give every member a zero score. Calling it again on a running
   * game restarts it: earlier scores and any open challenge are dropped.
   */
  public void start(PlayerId firstTurn) {
    started = true;
    scores.clear();
    players.forEach(p -> scores.put(p.id(), 0));
    challenge = null;
    currentTurn(firstTurn);
  }

  public PlayerId currentTurn() {
    return currentTurn;
  }

  public void currentTurn(PlayerId id) {
    if (player(id).isEmpty()) {
      throw new IllegalArgumentException(id + " is not a member of room " + code);
    }
    currentTurn = id;
  }

  public boolean isTurnOf(PlayerId id) {
    return started && id.equals(currentTurn);
  }

  public Challenge challenge() {
    return challenge;
  }

  public void challenge(Challenge c) {
    challenge = c;
  }

  public void clearChallenge() {
    challenge = null;
  }

  public Map<PlayerId, Integer> scores() {
    return Collections.unmodifiableMap(scores);
  }

  /** Add one point, treating a missing entry as zero. */
  public int incrementScore(PlayerId id) {
    return scores.merge(id, 1, Integer::sum);
  }

  public boolean closed() {
    return closed;
  }

  public void close() {
    closed = true;
  }

  /** Immutable copy of the visible state. */
  public Snapshot snapshot() {
    return new Snapshot(
        code,
        List.copyOf(players),
        started,
        currentTurn,
        Collections.unmodifiableMap(new LinkedHashMap<>(scores)),
        challenge,
        closed);
  }
}
