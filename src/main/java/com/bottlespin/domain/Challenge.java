package com.bottlespin.domain;

/** Challenge picked by the turn holder; {@code ownerId} is the turn holder at selection time. */
public record Challenge(String type, String text, PlayerId ownerId) {}
