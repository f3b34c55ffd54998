/*
 * どこで: Arena アプリの設定バインド
 * 何を: 結果イベント outbox の publish/リトライ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.arena.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "arena.outbox")
public record OutboxProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int batchSize,
    @Min(1) int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @NotNull Duration lease,
    @Min(16) int errorMessageMaxLength) {}
