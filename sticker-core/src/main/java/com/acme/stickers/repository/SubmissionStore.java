package com.acme.stickers.repository;

import com.acme.stickers.core.SubmissionEnvelope;
import com.acme.stickers.domain.Pack;
import com.acme.stickers.domain.Submission;
import java.util.Optional;

/**
 * Relational store of packs and per-user submissions. Uniqueness of {@code pack.short_name} and
 * of {@code (submission.user_id, submission.pack_id)} is enforced by the database.
 */
public interface SubmissionStore {

  /**
   * Records a submission in a single transaction: finds or creates the pack, then finds or creates
   * the user's submission of it. Repeating the call with the same envelope is a no-op reported as
   * {@link WriteOutcome#ALREADY_EXISTS}, including when a concurrent writer wins a unique-key race.
   *
   * @throws com.acme.stickers.core.TransientException on connectivity or lock failures
   * @throws com.acme.stickers.core.PermanentException on any other database error
   */
  RecordResult record(SubmissionEnvelope envelope);

  Optional<Pack> findPackByShortName(String shortName);

  Optional<Submission> findSubmission(long userId, long packId);

  /** Round trip to the database, throwing if it cannot be reached. */
  void ping();
}
