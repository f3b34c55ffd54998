/*
 * どこで: Arena API リクエスト DTO
 * 何を: ルーム作成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.arena.api.request;

import com.example.arena.model.GameSettings;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** 作成者の username と skill_level はそのまま最初の参加者になる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateSessionRequest(
    @NotBlank(message = "name is required")
        @Size(max = 50, message = "name must be at most 50 characters")
        String name,
    String type,
    Integer maxPlayers,
    GameSettings gameSettings,
    String username,
    @Min(value = 0, message = "skill_level must be >= 0") Integer skillLevel) {}
