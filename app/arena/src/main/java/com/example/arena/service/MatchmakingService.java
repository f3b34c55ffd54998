/*
 * どこで: Arena サービス層
 * 何を: キュー API の入力を MatchRequest に組み立てて MatchQueue へ渡し、結果を応答 DTO に変換する
 * なぜ: ソロ/チームの判定と既定値の補完をキュー本体から分けるため
 */
package com.example.arena.service;

import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.request.QueueJoinRequest;
import com.example.arena.api.request.TeamMemberRequest;
import com.example.arena.api.response.QueueCancelResponse;
import com.example.arena.api.response.QueueJoinResponse;
import com.example.arena.api.response.QueueStatisticsResponse;
import com.example.arena.api.response.QueueStatusResponse;
import com.example.arena.api.response.SessionResponse;
import com.example.arena.config.MatchmakingProperties;
import com.example.arena.model.MatchMode;
import com.example.arena.model.MatchRequest;
import com.example.arena.model.PairingResult;
import com.example.arena.model.TeamMember;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchmakingService {

  private final MatchQueue matchQueue;
  private final MatchmakingProperties properties;

  public QueueJoinResponse join(String userId, QueueJoinRequest request) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidSessionRequestException("X-User-Id is required");
    }
    final PairingResult result = matchQueue.pairAndCreateSession(toMatchRequest(userId, request));
    return new QueueJoinResponse(
        result.outcome().name().toLowerCase(Locale.ROOT),
        result.room() == null ? null : SessionResponse.from(result.room()),
        result.opponentIds(),
        result.queueStatus() == null ? null : QueueStatusResponse.from(result.queueStatus()));
  }

  public QueueCancelResponse cancel(String userId) {
    return new QueueCancelResponse(userId, matchQueue.dequeue(userId));
  }

  public QueueStatusResponse status(String userId) {
    return QueueStatusResponse.from(matchQueue.queueStatus(userId));
  }

  public QueueStatisticsResponse statistics() {
    return QueueStatisticsResponse.from(matchQueue.statistics());
  }

  private MatchRequest toMatchRequest(String userId, QueueJoinRequest request) {
    final MatchMode mode = MatchMode.fromValue(request.mode());
    final String username =
        request.username() == null || request.username().isBlank() ? userId : request.username();
    if (!request.isTeam()) {
      final int skill =
          request.skillLevel() == null ? properties.defaultSkillLevel() : request.skillLevel();
      return new MatchRequest.Solo(userId, username, skill, mode);
    }
    final List<TeamMember> members =
        request.team().stream().map(MatchmakingService::toMember).toList();
    return new MatchRequest.Team(userId, username, mode, members);
  }

  private static TeamMember toMember(TeamMemberRequest member) {
    final String username =
        member.username() == null || member.username().isBlank()
            ? member.userId()
            : member.username();
    return new TeamMember(member.userId(), username, member.skillLevel());
  }
}
