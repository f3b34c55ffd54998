package com.example.arena.api;

import com.example.arena.api.request.DailyStreakRequest;
import com.example.arena.api.request.FriendCountRequest;
import com.example.arena.api.response.PlayerAchievementsResponse;
import com.example.arena.api.response.PlayerProgressResponse;
import com.example.arena.api.response.PlayerStatsResponse;
import com.example.arena.service.PlayerProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** プレイヤー成績と実績の参照、および外部サービスからの成績値報告。 */
@RestController
@RequestMapping("/v1/players/{userId}")
@RequiredArgsConstructor
public class PlayerController {

  private final PlayerProgressService playerProgressService;

  @GetMapping("/stats")
  public ResponseEntity<PlayerStatsResponse> stats(@PathVariable("userId") String userId) {
    return ResponseEntity.ok(PlayerStatsResponse.from(playerProgressService.stats(userId)));
  }

  @GetMapping("/achievements")
  public ResponseEntity<PlayerAchievementsResponse> achievements(
      @PathVariable("userId") String userId) {
    return ResponseEntity.ok(
        PlayerAchievementsResponse.from(userId, playerProgressService.achievements(userId)));
  }

  @PutMapping("/daily-streak")
  public ResponseEntity<PlayerProgressResponse> dailyStreak(
      @PathVariable("userId") String userId, @Valid @RequestBody DailyStreakRequest request) {
    return ResponseEntity.ok(
        PlayerProgressResponse.from(
            playerProgressService.recordDailyStreak(userId, request.dailyStreak())));
  }

  @PutMapping("/friend-count")
  public ResponseEntity<PlayerProgressResponse> friendCount(
      @PathVariable("userId") String userId, @Valid @RequestBody FriendCountRequest request) {
    return ResponseEntity.ok(
        PlayerProgressResponse.from(
            playerProgressService.recordFriendCount(userId, request.friendCount())));
  }
}
