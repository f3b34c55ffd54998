/*
 * どこで: Arena Repository 層
 * 何を: ルーム hash・インデックス・イベントログの操作を抽象化する
 * なぜ: Redis/Lua の実装詳細を SessionStore から切り離すため
 */
package com.example.arena.repository;

import com.example.arena.model.Room;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface RoomRepository {

  /**
   * 役割: 新しいルームを登録する。 動作: hash の作成・TTL 設定・rooms:active と rooms:waiting への登録を 1 スクリプトで行い、同じ id
   * が既に存在すれば false を返す。 前提: room.version() は 1 であること。
   */
  boolean create(Room room, Duration ttl);

  /** 役割: ルームを取得する。 動作: hash が存在すれば復元して返し、期限切れ/削除済みなら empty を返す。 前提: roomId は空でないこと。 */
  Optional<Room> findById(String roomId);

  /**
   * 役割: version を条件にルームを書き換える。 動作: 保存中の version が expectedVersion と一致する場合だけフィールドを書き込み、version
   * を 1 進め、状態に応じた TTL と waiting インデックスを更新する。 前提: updated.id() が対象ルームであること。
   */
  CasOutcome compareAndSet(Room updated, long expectedVersion, Duration ttl);

  /**
   * 役割: ルームと付随キーを削除する。 動作: expectedVersion が null なら無条件、指定時は version 一致の場合だけ削除する。 前提: roomId
   * は空でないこと。
   */
  boolean delete(String roomId, Long expectedVersion);

  /** 役割: 参加受付中ルームの id を新しい順に返す。 動作: rooms:waiting を createdAt の降順で offset から count 件読む。 */
  List<String> findWaitingRoomIds(long offset, long count);

  /** 役割: 稼働中とみなしているルーム id を返す。 動作: rooms:active の全メンバーを返す。 */
  Set<String> findActiveRoomIds();

  /** 役割: hash が消えたルームをインデックスから外す。 動作: rooms:active と rooms:waiting の両方から削除する。 */
  void removeFromIndexes(String roomId);

  /**
   * 役割: ゲームイベントをログに追記する。 動作: ルーム hash が残っている場合だけ末尾に追加し、最新 maxEntries 件を残して TTL を更新する。
   *
   * @return 追記した場合 true、ルームが既に削除されていた場合 false
   */
  boolean appendEvent(String roomId, String eventJson, int maxEntries, Duration ttl);

  /** 役割: 直近のゲームイベントを返す。 動作: 古い順に最大 limit 件を返す。 */
  List<String> findRecentEvents(String roomId, int limit);
}
