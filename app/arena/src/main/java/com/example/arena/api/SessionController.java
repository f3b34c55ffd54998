/*
 * どこで: Arena API
 * 何を: ルームの作成・参加・退出・ready・ゲームイベント送信エンドポイントを公開する
 * なぜ: ルームのライフサイクル操作を 1 つのリソース配下にまとめるため
 */
package com.example.arena.api;

import com.example.arena.api.request.CreateSessionRequest;
import com.example.arena.api.request.JoinSessionRequest;
import com.example.arena.api.request.ReadyRequest;
import com.example.arena.api.request.UpdateSessionRequest;
import com.example.arena.api.response.LeaveSessionResponse;
import com.example.arena.api.response.ReadyResponse;
import com.example.arena.api.response.SessionEventsResponse;
import com.example.arena.api.response.SessionListResponse;
import com.example.arena.api.response.SessionResponse;
import com.example.arena.model.event.GameEvent;
import com.example.arena.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final SessionService sessionService;

  @PostMapping
  public ResponseEntity<SessionResponse> create(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CreateSessionRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.create(userId, request));
  }

  @GetMapping
  public ResponseEntity<SessionListResponse> listAvailable(
      @RequestParam(name = "type", required = false) String type,
      @RequestParam(name = "limit", defaultValue = "20")
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 100, message = "limit must be <= 100")
          int limit) {
    return ResponseEntity.ok(sessionService.listAvailable(type, limit));
  }

  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> get(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(sessionService.get(sessionId));
  }

  @PatchMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> update(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody UpdateSessionRequest request) {
    return ResponseEntity.ok(sessionService.update(sessionId, userId, request));
  }

  @DeleteMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> delete(
      @PathVariable("sessionId") String sessionId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(sessionService.delete(sessionId, userId));
  }

  @PostMapping("/{sessionId}/participants")
  public ResponseEntity<SessionResponse> join(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) JoinSessionRequest request) {
    return ResponseEntity.ok(sessionService.join(sessionId, userId, request));
  }

  @DeleteMapping("/{sessionId}/participants/me")
  public ResponseEntity<LeaveSessionResponse> leave(
      @PathVariable("sessionId") String sessionId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(sessionService.leave(sessionId, userId));
  }

  @PutMapping("/{sessionId}/ready")
  public ResponseEntity<ReadyResponse> ready(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ReadyRequest request) {
    return ResponseEntity.ok(sessionService.ready(sessionId, userId, request.ready()));
  }

  @PostMapping("/{sessionId}/events")
  public ResponseEntity<SessionResponse> submitEvent(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestBody GameEvent event) {
    return ResponseEntity.ok(sessionService.submitEvent(sessionId, userId, event));
  }

  @GetMapping("/{sessionId}/events")
  public ResponseEntity<SessionEventsResponse> events(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be >= 1")
          int limit) {
    return ResponseEntity.ok(sessionService.events(sessionId, userId, limit));
  }
}
