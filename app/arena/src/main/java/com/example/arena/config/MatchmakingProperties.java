/*
 * どこで: Arena 設定
 * 何を: 待機キューの TTL・スキル幅・ワーカー設定を保持する
 * なぜ: quick/ranked の許容スキル差や掃除間隔を運用で調整するため
 */
package com.example.arena.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "arena.matchmaking")
public record MatchmakingProperties(
    @NotNull Duration entryTtl,
    @NotNull Duration maxWait,
    @NotNull Duration matchedTtl,
    @Min(0) int quickSkillRange,
    @Min(0) int rankedSkillRange,
    @Min(0) int defaultSkillLevel,
    @Min(1) int maxSkillLevel,
    @Min(1) int claimMaxAttempts,
    @Min(1) int maxTeamSize,
    @Min(1) long quickPerfectScore,
    @NotNull Duration rankedTimeLimit,
    @NotNull Duration workerPollInterval,
    boolean workerEnabled) {}
