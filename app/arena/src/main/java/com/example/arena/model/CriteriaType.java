/*
 * どこで: Arena ドメインモデル
 * 何を: 実績の判定基準と、統計スナップショットからの観測値取り出しを定義する
 * なぜ: 判定種別ごとの分岐を 1 箇所に閉じ込めるため
 */
package com.example.arena.model;

public enum CriteriaType {
  TOTAL_SCORE("total_score"),
  GAMES_PLAYED("games_played"),
  WINS("wins"),
  WIN_STREAK("win_streak"),
  PERFECT_SCORE("perfect_score"),
  DAILY_STREAK("daily_streak"),
  FRIENDS("friends"),
  GAME_TYPE_MASTERY("game_type_mastery"),
  ACHIEVEMENTS_UNLOCKED("achievements_unlocked");

  private final String value;

  CriteriaType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 観測値を返す。
   *
   * @param unlockedCount 評価パス開始時点の解除済み実績数（achievements_unlocked 用）
   */
  public long observe(LeaderboardRecord snapshot, String metric, int unlockedCount) {
    return switch (this) {
      case TOTAL_SCORE -> snapshot.totalScore();
      case GAMES_PLAYED -> snapshot.gamesPlayed();
      case WINS -> snapshot.wins();
      case WIN_STREAK -> snapshot.currentWinStreak();
      case PERFECT_SCORE -> snapshot.perfectGames();
      case DAILY_STREAK -> snapshot.dailyStreak();
      case FRIENDS -> snapshot.friendCount();
      case GAME_TYPE_MASTERY -> metric == null ? 0 : snapshot.gameTypeScore(metric);
      case ACHIEVEMENTS_UNLOCKED -> unlockedCount;
    };
  }

  public static CriteriaType fromValue(String value) {
    for (CriteriaType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported criteria type: " + value);
  }
}
