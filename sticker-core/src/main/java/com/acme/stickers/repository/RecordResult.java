package com.acme.stickers.repository;

/**
 * Outcome of recording one submission.
 *
 * @param packId key of the pack the submission refers to
 * @param pack whether the pack row was created by this call
 * @param submission whether the submission row was created by this call
 */
public record RecordResult(long packId, WriteOutcome pack, WriteOutcome submission) {

  public boolean isNewSubmission() {
    return submission == WriteOutcome.INSERTED;
  }

  public boolean isNewPack() {
    return pack == WriteOutcome.INSERTED;
  }
}
