/*
 * どこで: Arena API レスポンス DTO
 * 何を: キュー登録 API の応答を定義する
 * なぜ: 即時成立・並行成立・待機継続の 3 通りを共通構造で返すため
 */
package com.example.arena.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * @param outcome matched / already_matched / queued
 * @param session この呼び出しで作成したルーム。matched のときだけ入る
 * @param queue 待機中または並行成立時の状態
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueJoinResponse(
    String outcome, SessionResponse session, List<String> opponentIds, QueueStatusResponse queue) {}
