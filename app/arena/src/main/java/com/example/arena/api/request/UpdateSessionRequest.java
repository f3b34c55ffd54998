package com.example.arena.api.request;

import com.example.arena.model.GameSettings;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateSessionRequest(
    @Size(max = 50, message = "name must be at most 50 characters") String name,
    String type,
    Integer maxPlayers,
    GameSettings gameSettings) {}
