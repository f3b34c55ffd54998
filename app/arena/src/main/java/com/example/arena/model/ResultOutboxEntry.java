package com.example.arena.model;

import java.time.Instant;
import java.util.UUID;

/**
 * claim した result_outbox の 1 行。
 *
 * @param kind SessionFinished などの outbox 上の種別
 * @param userId 実績イベントの対象ユーザー、セッション終了イベントでは null
 * @param attempts これまでに失敗した送信の回数
 */
public record ResultOutboxEntry(
    UUID eventId,
    String kind,
    String sessionId,
    String userId,
    String payloadJson,
    int attempts,
    Instant enqueuedAt) {}
