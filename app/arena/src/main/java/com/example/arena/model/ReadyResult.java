package com.example.arena.model;

/**
 * @param countdownStarted この呼び出しでカウントダウンを開始した（並行呼び出しのうち 1 件だけが true）
 * @param countdownCancelled この呼び出しで進行中のカウントダウンを取り消した
 */
public record ReadyResult(
    Room room, boolean allReady, boolean countdownStarted, boolean countdownCancelled) {}
