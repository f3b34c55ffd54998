package com.example.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JoinSessionRequest(
    String username, @Min(value = 0, message = "skill_level must be >= 0") Integer skillLevel) {}
