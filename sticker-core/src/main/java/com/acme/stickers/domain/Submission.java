package com.acme.stickers.domain;

import java.time.Instant;

/** One user's recorded act of submitting one pack. At most one exists per (userId, packId). */
public record Submission(Long id, long userId, long packId, Instant submittedAt) {}
