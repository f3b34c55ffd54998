package com.example.arena.api.response;

import java.util.List;

public record AchievementListResponse(List<AchievementResponse> achievements) {}
