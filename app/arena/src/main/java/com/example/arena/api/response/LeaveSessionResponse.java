package com.example.arena.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param session 退出後のルーム。削除された場合は削除直前の状態
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeaveSessionResponse(
    String sessionId, boolean deleted, boolean creatorChanged, SessionResponse session) {}
