package com.example.arena.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "arena.achievement")
public record AchievementProperties(@NotNull Duration catalogTtl) {}
