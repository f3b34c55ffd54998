package com.example.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FriendCountRequest(
    @NotNull(message = "friend_count is required")
        @Min(value = 0, message = "friend_count must be >= 0")
        Integer friendCount) {}
