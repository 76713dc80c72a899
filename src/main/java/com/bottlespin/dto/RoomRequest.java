package com.bottlespin.dto;

import jakarta.validation.constraints.NotBlank;

/** Payload of the turn operations that only name a room (start, spin, complete, skip). */
public record RoomRequest(@NotBlank String roomCode) {}
