package com.bottlespin.dto;

public record JoinRoomRequest(String roomCode, String playerName) {}
