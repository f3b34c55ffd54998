/*
 * どこで: Arena API
 * 何を: エラー応答の安定コードを定義する
 * なぜ: 同じ HTTP ステータスでも原因をクライアントが区別できるようにするため
 */
package com.example.arena.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  SESSION_NOT_FOUND,
  QUEUE_ENTRY_NOT_FOUND,
  NOT_A_PARTICIPANT,
  FORBIDDEN,
  SESSION_FULL,
  ALREADY_JOINED,
  SESSION_NOT_JOINABLE,
  SESSION_STATE_CONFLICT,
  ALREADY_QUEUED,
  CONCURRENT_MODIFICATION,
  DEPENDENCY_UNAVAILABLE,
  INTERNAL_ERROR
}
