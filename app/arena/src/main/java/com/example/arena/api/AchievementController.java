package com.example.arena.api;

import com.example.arena.api.response.AchievementListResponse;
import com.example.arena.api.response.AchievementResponse;
import com.example.arena.service.AchievementEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/achievements")
@RequiredArgsConstructor
public class AchievementController {

  private final AchievementEngine achievementEngine;

  @GetMapping
  public ResponseEntity<AchievementListResponse> list() {
    return ResponseEntity.ok(
        new AchievementListResponse(
            achievementEngine.listDefinitions().stream().map(AchievementResponse::from).toList()));
  }
}
