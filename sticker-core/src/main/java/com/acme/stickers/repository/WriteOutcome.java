package com.acme.stickers.repository;

/** Result of an idempotent insert. */
public enum WriteOutcome {
  INSERTED,
  ALREADY_EXISTS
}
