package com.example.arena.model;

/**
 * @param room 退出後のルーム。deleted の場合は削除直前、removed でない場合は読み取った時点の状態
 * @param removed 参加者一覧から外した。待機中でなくなっていた場合は false
 * @param deleted 最後の参加者が抜けてルームを削除した
 * @param creatorChanged 作成者が抜けて所有権が移った
 */
public record LeaveResult(Room room, boolean removed, boolean deleted, boolean creatorChanged) {

  public static LeaveResult notWaiting(Room room) {
    return new LeaveResult(room, false, false, false);
  }
}
