package com.example.arena.model;

public record GameTypeScore(long score, int gamesPlayed) {}
