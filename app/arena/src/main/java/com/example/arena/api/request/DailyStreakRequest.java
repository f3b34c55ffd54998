package com.example.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** 連続ログイン日数。集計は外部サービスが行い、ここでは報告値をそのまま保存する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyStreakRequest(
    @NotNull(message = "daily_streak is required")
        @Min(value = 0, message = "daily_streak must be >= 0")
        Integer dailyStreak) {}
