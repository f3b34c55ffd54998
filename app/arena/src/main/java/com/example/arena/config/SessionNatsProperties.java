/*
 * どこで: Arena 設定
 * 何を: NATS の stream と subject（live 配信 / 結果配信）を保持する
 * なぜ: subject/stream の運用切り替えを容易にするため
 */
package com.example.arena.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "arena.nats")
public record SessionNatsProperties(
    String stream, String sessionSubject, String resultSubject, Duration duplicateWindow) {}
