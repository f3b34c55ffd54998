package com.example.arena.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReadyResponse(
    SessionResponse session,
    boolean allReady,
    boolean countdownStarted,
    boolean countdownCancelled) {}
