package com.bottlespin.domain;

import java.util.List;
import java.util.Map;

public record Snapshot(
    String code,
    List<Player> players,
    boolean started,
    PlayerId currentTurn,
    Map<PlayerId, Integer> scores,
    Challenge challenge,
    boolean closed
) {}
