/*
 * どこで: Arena Repository 層
 * 何を: スキル順待機キューと player メタデータの永続化操作を抽象化する
 * なぜ: Redis 実装詳細を MatchQueue から切り離すため
 */
package com.example.arena.repository;

import com.example.arena.model.QueueEntry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface MatchQueueRepository {

  /**
   * 役割: キューへ登録/再登録する。 動作: player hash を作り直して TTL を設定し、skillLevel をスコアに sorted set へ追加する。
   * メンバー全員をエントリ所有者に紐付け、別エントリに並んでいるメンバーがいれば何もせず MEMBER_ALREADY_QUEUED を返す。 前提:
   * entry.userId() は空でないこと。
   */
  EnqueueOutcome upsert(QueueEntry entry, Duration ttl);

  /** 役割: キューから外す。 動作: sorted set から削除し、待機中メタデータとメンバー索引も消す。存在しなければ false。 */
  boolean remove(String userId);

  /** 役割: 待機中エントリを取得する。 動作: player hash が待機状態で残っていれば返し、期限切れ/マッチ済みなら empty。 */
  Optional<QueueEntry> findEntry(String userId);

  /** 役割: マッチ済みユーザーのセッション id を返す。 動作: player hash が MATCHED 状態ならその session_id を返す。 */
  Optional<String> findMatchedSessionId(String userId);

  /**
   * 役割: スキル範囲内の候補を返す。 動作: sorted set を [minSkill, maxSkill] で絞り、メタデータが残っているエントリだけを返す。 前提: minSkill
   * &lt;= maxSkill。
   */
  List<QueueEntry> findCandidates(int minSkill, int maxSkill);

  /** 役割: キュー上の全 userId を返す。 動作: sorted set をスキル昇順で全件返す。 */
  List<String> findAllQueuedUserIds();

  /** 役割: スキル昇順での 0 始まり順位を返す。 動作: キューにいなければ empty。 */
  Optional<Long> rank(String userId);

  /** 役割: キューの長さを返す。 */
  long size();

  /**
   * 役割: 2 エントリを同時に確保する。 動作: 両方がキューに残っている場合だけ両方を外してメンバー索引を解放し、player hash を
   * MATCHED(sessionId) に置き換える。どちらかが欠けていれば何も変更しない。 前提: userId と opponentId は異なること。
   */
  ClaimOutcome claimPair(String userId, String opponentId, String sessionId, Duration matchedTtl);
}
