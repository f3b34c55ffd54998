/*
 * どこで: Arena API
 * 何を: 待機キューへの登録・取消・状態照会・統計エンドポイントを公開する
 * なぜ: クライアントからのマッチング要求を受け付ける入口を提供するため
 */
package com.example.arena.api;

import com.example.arena.api.request.QueueJoinRequest;
import com.example.arena.api.response.QueueCancelResponse;
import com.example.arena.api.response.QueueJoinResponse;
import com.example.arena.api.response.QueueStatisticsResponse;
import com.example.arena.api.response.QueueStatusResponse;
import com.example.arena.service.MatchmakingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matchmaking")
@RequiredArgsConstructor
public class MatchmakingController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MatchmakingService matchmakingService;

  @PostMapping("/queue")
  public ResponseEntity<QueueJoinResponse> join(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody QueueJoinRequest request) {
    return ResponseEntity.ok(matchmakingService.join(userId, request));
  }

  @DeleteMapping("/queue")
  public ResponseEntity<QueueCancelResponse> cancel(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(matchmakingService.cancel(userId));
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> status(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(matchmakingService.status(userId));
  }

  @GetMapping("/statistics")
  public ResponseEntity<QueueStatisticsResponse> statistics() {
    return ResponseEntity.ok(matchmakingService.statistics());
  }
}
