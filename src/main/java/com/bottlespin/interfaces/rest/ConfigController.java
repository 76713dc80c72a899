package com.bottlespin.interfaces.rest;

import com.bottlespin.application.RoomCodeGenerator;
import com.bottlespin.domain.GameRoom;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final long turnChangeDelayMs;
  private final long disconnectGraceMs;

  public ConfigController(
      @Value("${bottlespin.turn-change-delay-ms:2000}") long turnChangeDelayMs,
      @Value("${bottlespin.disconnect-grace-ms:30000}") long disconnectGraceMs) {
    this.turnChangeDelayMs = turnChangeDelayMs;
    this.disconnectGraceMs = disconnectGraceMs;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "maxPlayers", GameRoom.MAX_PLAYERS,
        "roomCodeLength", RoomCodeGenerator.CODE_LENGTH,
        "roomCodeAlphabet", RoomCodeGenerator.ALPHABET,
        "turnChangeDelayMs", turnChangeDelayMs,
        "disconnectGraceMs", disconnectGraceMs,
        "protocolVersion", 1);
  }
}
