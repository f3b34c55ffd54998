/*
 * どこで: Arena サービス層
 * 何を: ルーム API の各操作を SessionStore / GameEventProcessor へ振り分け、応答 DTO に変換する
 * なぜ: 状態変更と配信イベントの組み合わせをコントローラから切り離すため
 */
package com.example.arena.service;

import com.example.arena.api.InvalidSessionRequestException;
import com.example.arena.api.SessionAccessDeniedException;
import com.example.arena.api.request.CreateSessionRequest;
import com.example.arena.api.request.JoinSessionRequest;
import com.example.arena.api.request.UpdateSessionRequest;
import com.example.arena.api.response.LeaveSessionResponse;
import com.example.arena.api.response.ReadyResponse;
import com.example.arena.api.response.SessionEventsResponse;
import com.example.arena.api.response.SessionListResponse;
import com.example.arena.api.response.SessionResponse;
import com.example.arena.config.MatchmakingProperties;
import com.example.arena.model.CreateRoomCommand;
import com.example.arena.model.LeaveResult;
import com.example.arena.model.ReadyResult;
import com.example.arena.model.Room;
import com.example.arena.model.RoomUpdate;
import com.example.arena.model.TeamMember;
import com.example.arena.model.event.GameEvent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class SessionService {

  private final SessionStore sessionStore;
  private final GameEventProcessor gameEventProcessor;
  private final SessionEventPublisher eventPublisher;
  private final MatchmakingProperties matchmakingProperties;

  public SessionService(
      SessionStore sessionStore,
      GameEventProcessor gameEventProcessor,
      SessionEventPublisher eventPublisher,
      MatchmakingProperties matchmakingProperties) {
    this.sessionStore = sessionStore;
    this.gameEventProcessor = gameEventProcessor;
    this.eventPublisher = eventPublisher;
    this.matchmakingProperties = matchmakingProperties;
  }

  public SessionResponse create(String userId, CreateSessionRequest request) {
    requireUser(userId);
    final TeamMember creator = member(userId, request.username(), request.skillLevel());
    final Room room =
        sessionStore.create(
            new CreateRoomCommand(
                null,
                request.name(),
                request.type(),
                request.maxPlayers(),
                request.gameSettings(),
                List.of(creator),
                false));
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", room.name());
    data.put("type", room.type());
    data.put("max_players", room.maxPlayers());
    eventPublisher.publish("session-created", room.id(), userId, data);
    return SessionResponse.from(room);
  }

  public SessionResponse get(String sessionId) {
    return SessionResponse.from(sessionStore.get(sessionId));
  }

  public SessionListResponse listAvailable(String type, int limit) {
    final List<SessionResponse> sessions =
        sessionStore.listAvailable(type, limit).stream().map(SessionResponse::from).toList();
    return new SessionListResponse(sessions, sessions.size());
  }

  public SessionResponse update(String sessionId, String userId, UpdateSessionRequest request) {
    requireUser(userId);
    final Room room =
        sessionStore.update(
            sessionId,
            userId,
            new RoomUpdate(
                request.name(), request.type(), request.maxPlayers(), request.gameSettings()));
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", room.name());
    data.put("type", room.type());
    data.put("max_players", room.maxPlayers());
    eventPublisher.publish("session-updated", sessionId, userId, data);
    return SessionResponse.from(room);
  }

  public SessionResponse delete(String sessionId, String userId) {
    requireUser(userId);
    final Room room = sessionStore.delete(sessionId, userId);
    eventPublisher.publish("session-deleted", sessionId, userId, Map.of("reason", "deleted"));
    return SessionResponse.from(room);
  }

  public SessionResponse join(String sessionId, String userId, JoinSessionRequest request) {
    requireUser(userId);
    final String username = request == null ? null : request.username();
    final Integer skillLevel = request == null ? null : request.skillLevel();
    final Room room = sessionStore.addParticipant(sessionId, member(userId, username, skillLevel));
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("username", username == null ? userId : username);
    data.put("players", room.currentPlayers());
    eventPublisher.publish("session-joined", sessionId, userId, data);
    return SessionResponse.from(room);
  }

  public LeaveSessionResponse leave(String sessionId, String userId) {
    requireUser(userId);
    final LeaveResult result = gameEventProcessor.leave(sessionId, userId);
    return new LeaveSessionResponse(
        sessionId, result.deleted(), result.creatorChanged(), SessionResponse.from(result.room()));
  }

  public ReadyResponse ready(String sessionId, String userId, boolean ready) {
    requireUser(userId);
    final ReadyResult result = sessionStore.updatePlayerReady(sessionId, userId, ready);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("ready", ready);
    data.put("all_ready", result.allReady());
    eventPublisher.publish("session-updated", sessionId, userId, data);
    if (result.countdownStarted()) {
      gameEventProcessor.scheduleStart(result.room());
    }
    return new ReadyResponse(
        SessionResponse.from(result.room()),
        result.allReady(),
        result.countdownStarted(),
        result.countdownCancelled());
  }

  public SessionResponse submitEvent(String sessionId, String userId, GameEvent event) {
    requireUser(userId);
    return SessionResponse.from(gameEventProcessor.handle(sessionId, userId, event));
  }

  public SessionEventsResponse events(String sessionId, String userId, int limit) {
    requireUser(userId);
    final Room room = sessionStore.get(sessionId);
    if (!room.hasParticipant(userId)) {
      throw SessionAccessDeniedException.notParticipant(sessionId);
    }
    return new SessionEventsResponse(sessionId, sessionStore.recentEvents(sessionId, limit));
  }

  private TeamMember member(String userId, String username, Integer skillLevel) {
    final int skill = skillLevel == null ? matchmakingProperties.defaultSkillLevel() : skillLevel;
    return new TeamMember(userId, username == null || username.isBlank() ? userId : username, skill);
  }

  private static void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidSessionRequestException("X-User-Id is required");
    }
  }
}
