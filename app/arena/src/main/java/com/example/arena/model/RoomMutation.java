package com.example.arena.model;

/** CAS 更新 1 回ぶんの前後。before は書き込みが成立した時点の値。 */
public record RoomMutation(Room before, Room after) {

  public boolean changed() {
    return before != after;
  }
}
