/*
 * どこで: Arena サービス層
 * 何を: 終了したルームの参加者から順位と勝敗を決める
 * なぜ: 明示終了と再精算で同じルーム状態から必ず同じ順位を得るため
 */
package com.example.arena.service;

import com.example.arena.config.SessionProperties;
import com.example.arena.model.FinishReason;
import com.example.arena.model.GameResult;
import com.example.arena.model.PlayerStanding;
import com.example.arena.model.Room;
import com.example.arena.model.RoomParticipant;
import com.example.arena.model.SessionOutcome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class StandingsCalculator {

  private final SessionProperties properties;

  public StandingsCalculator(SessionProperties properties) {
    this.properties = properties;
  }

  public SessionOutcome outcome(Room room) {
    final FinishReason reason =
        room.finishReason() == null ? FinishReason.EXPLICIT : room.finishReason();
    return new SessionOutcome(
        room.id(),
        room.gameSettings().gameType(),
        room.gameSettings().perfectScore(),
        reason,
        room.finishedAt(),
        standings(room.participants(), reason));
  }

  /**
   * スコア降順（同点は参加順）に並べる。
   *
   * <p>棄権による終了で活動中の参加者が 1 名だけなら、その参加者を先頭の勝者とし最低保証スコアを与える。
   */
  public List<PlayerStanding> standings(List<RoomParticipant> participants, FinishReason reason) {
    final List<RoomParticipant> active = participants.stream().filter(RoomParticipant::active).toList();
    if (reason == FinishReason.FORFEIT && active.size() == 1) {
      return forfeitStandings(participants, active.get(0));
    }
    final List<RoomParticipant> sorted = sortByScore(participants);
    if (sorted.isEmpty()) {
      return List.of();
    }
    final long topScore = sorted.get(0).score();
    final long topCount = sorted.stream().filter(p -> p.score() == topScore).count();
    final List<PlayerStanding> standings = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      final RoomParticipant p = sorted.get(i);
      final GameResult result;
      if (p.score() == topScore) {
        result = topCount > 1 ? GameResult.DRAW : GameResult.WIN;
      } else {
        result = GameResult.LOSS;
      }
      standings.add(new PlayerStanding(p.userId(), p.username(), result, p.score(), i + 1));
    }
    return standings;
  }

  private List<PlayerStanding> forfeitStandings(
      List<RoomParticipant> participants, RoomParticipant winner) {
    final List<PlayerStanding> standings = new ArrayList<>(participants.size());
    // 下限スコアはまだ得点のない勝者にだけ与える
    final long winnerScore = winner.score() > 0 ? winner.score() : properties.forfeitFloorScore();
    standings.add(
        new PlayerStanding(winner.userId(), winner.username(), GameResult.WIN, winnerScore, 1));
    final List<RoomParticipant> others =
        sortByScore(
            participants.stream().filter(p -> !p.userId().equals(winner.userId())).toList());
    for (int i = 0; i < others.size(); i++) {
      final RoomParticipant p = others.get(i);
      standings.add(
          new PlayerStanding(
              p.userId(), p.username(), GameResult.LOSS, Math.max(0, p.score()), i + 2));
    }
    return standings;
  }

  // List.sort は安定ソートなので同点は参加順のまま残る
  private static List<RoomParticipant> sortByScore(List<RoomParticipant> participants) {
    final List<RoomParticipant> sorted = new ArrayList<>(participants);
    sorted.sort(Comparator.comparingLong(RoomParticipant::score).reversed());
    return sorted;
  }
}
