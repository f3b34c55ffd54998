package com.example.arena.repository;

public enum CasOutcome {
  APPLIED,
  VERSION_MISMATCH,
  NOT_FOUND
}
