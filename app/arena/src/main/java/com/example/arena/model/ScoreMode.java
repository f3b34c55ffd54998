package com.example.arena.model;

/** スコアイベントの更新方式。 */
public enum ScoreMode {
  /** 現在値へ加算する（設問ごとの採点）。 */
  ADD,
  /** 現在値より大きい場合だけ上書きする（テスト通過数の追跡）。 */
  SET_MAX
}
