package com.bottlespin.dto;

import com.bottlespin.domain.Player;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record PlayerView(String id, String name, @JsonProperty("isHost") boolean host) {

  public static PlayerView of(Player p) {
    return new PlayerView(p.id().value(), p.name(), p.host());
  }

  public static List<PlayerView> ofAll(List<Player> players) {
    return players.stream().map(PlayerView::of).toList();
  }
}
