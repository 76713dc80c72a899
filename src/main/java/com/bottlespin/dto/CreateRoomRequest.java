package com.bottlespin.dto;

public record CreateRoomRequest(String playerName) {}
