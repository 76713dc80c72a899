package com.bottlespin.dto;

import jakarta.validation.constraints.NotBlank;

/** Challenge kind and text are relayed as sent, blank or not. */
public record SelectChallengeRequest(@NotBlank String roomCode, String type, String challenge) {}
