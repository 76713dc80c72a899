package com.bottlespin.domain;

public record Player(PlayerId id, String connectionId, String name, boolean host) {}
