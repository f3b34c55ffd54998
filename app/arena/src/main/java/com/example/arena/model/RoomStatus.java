/*
 * どこで: Arena ドメインモデル
 * 何を: ルームのライフサイクル状態を表す
 * なぜ: 状態遷移を単調（戻りなし）に制限するため
 */
package com.example.arena.model;

public enum RoomStatus {
  WAITING("waiting"),
  PLAYING("playing"),
  FINISHED("finished");

  private final String value;

  RoomStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 同一状態への遷移は許可し、前の状態へ戻る遷移だけを拒否する。 */
  public boolean canTransitionTo(RoomStatus next) {
    return next != null && next.ordinal() >= ordinal();
  }

  public static RoomStatus fromValue(String value) {
    for (RoomStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unsupported room status: " + value);
  }
}
