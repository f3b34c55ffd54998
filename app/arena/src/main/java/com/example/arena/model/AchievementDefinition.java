package com.example.arena.model;

public record AchievementDefinition(
    String achievementId,
    String name,
    String description,
    String category,
    CriteriaType criteriaType,
    long target,
    String metric,
    int points) {}
