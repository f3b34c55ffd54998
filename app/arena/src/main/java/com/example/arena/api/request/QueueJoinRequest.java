/*
 * どこで: Arena API リクエスト DTO
 * 何を: キュー登録 API の入力を定義する
 * なぜ: ソロ登録とチーム登録を 1 つのエンドポイントで受けるため
 */
package com.example.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * @param skillLevel 省略時は設定の既定スキルを使う
 * @param team 指定した場合はチーム登録になり、リクエスト元ユーザーがリーダーになる
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record QueueJoinRequest(
    String username,
    @Min(value = 0, message = "skill_level must be >= 0") Integer skillLevel,
    @NotBlank(message = "mode is required")
        @Pattern(regexp = "quick|ranked", message = "mode must be quick or ranked")
        String mode,
    List<@Valid TeamMemberRequest> team) {

  public boolean isTeam() {
    return team != null && !team.isEmpty();
  }
}
