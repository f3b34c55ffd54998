package com.example.arena.service;

import java.util.Map;

/**
 * ルーム内のライブイベント（参加・準備・スコア更新など）を配信する。
 *
 * <p>配信はベストエフォートで、失敗しても呼び出し元のルーム更新は取り消さない。
 */
public interface SessionEventPublisher {

  void publish(String eventType, String sessionId, String userId, Map<String, Object> data);
}
