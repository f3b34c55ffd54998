package com.example.arena.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerAchievementResponse(
    String achievementId,
    String name,
    String category,
    int points,
    boolean unlocked,
    String unlockedAt,
    BigDecimal progress) {}
