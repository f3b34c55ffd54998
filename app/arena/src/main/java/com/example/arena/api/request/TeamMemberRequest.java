package com.example.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamMemberRequest(
    @NotBlank(message = "team member user_id is required") String userId,
    String username,
    @NotNull(message = "team member skill_level is required")
        @Min(value = 0, message = "skill_level must be >= 0")
        Integer skillLevel) {}
