package com.example.arena.model;

import java.math.BigDecimal;

/**
 * 1 実績ぶんの評価結果。unlocked はこの評価で新規解除したもの、alreadyUnlocked は並行評価に先を越されたもの。
 */
public record AchievementEvaluation(
    String achievementId,
    String name,
    boolean unlocked,
    boolean alreadyUnlocked,
    BigDecimal progress,
    BigDecimal previousProgress,
    int pointsAwarded) {}
