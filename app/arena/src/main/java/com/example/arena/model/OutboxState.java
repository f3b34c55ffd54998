package com.example.arena.model;

/** result_outbox.state の値。QUEUED → SENDING → SENT、送信を諦めたものは DEAD。 */
public enum OutboxState {
  QUEUED,
  SENDING,
  SENT,
  DEAD
}
