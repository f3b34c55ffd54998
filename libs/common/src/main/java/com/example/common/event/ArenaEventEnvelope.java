/*
 * どこで: common のイベント定義
 * 何を: NATS へ流すセッション/実績イベントの共通エンベロープ
 * なぜ: live 配信と outbox 配信で同じ JSON 形状を使うため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArenaEventEnvelope(
    String eventId,
    String eventType,
    String occurredAt,
    String sessionId,
    String userId,
    String traceId,
    Map<String, Object> data) {

  public ArenaEventEnvelope {
    // data には null 値が入り得るので Map.copyOf は使わない
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
