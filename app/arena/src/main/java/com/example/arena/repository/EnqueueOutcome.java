package com.example.arena.repository;

public enum EnqueueOutcome {
  QUEUED,
  /** メンバーの誰かが別のエントリ（ソロまたは他チーム）で既に並んでいる。何も書き込んでいない。 */
  MEMBER_ALREADY_QUEUED
}
