/*
 * どこで: Arena ゲーム内イベント
 * 何を: ルーム内イベントを type で判別する閉じた型として定義する
 * なぜ: 未知の type を JSON 変換時点で明示的に拒否するため
 */
package com.example.arena.model.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ScoreEvent.class, name = "score"),
  @JsonSubTypes.Type(value = TimerEvent.class, name = "timer"),
  @JsonSubTypes.Type(value = HintEvent.class, name = "hint"),
  @JsonSubTypes.Type(value = SurrenderEvent.class, name = "surrender"),
  @JsonSubTypes.Type(value = LeaveEvent.class, name = "leave"),
  @JsonSubTypes.Type(value = FinishEvent.class, name = "finish")
})
public sealed interface GameEvent
    permits ScoreEvent, TimerEvent, HintEvent, SurrenderEvent, LeaveEvent, FinishEvent {

  GameEventKind kind();
}
