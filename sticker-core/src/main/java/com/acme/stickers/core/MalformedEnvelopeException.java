package com.acme.stickers.core;

/**
 * A queue payload that can never be turned into a {@link SubmissionEnvelope}. Discarded by the
 * consumer, never retried.
 */
public class MalformedEnvelopeException extends PermanentException {
  public MalformedEnvelopeException(String message) {
    super(message);
  }

  public MalformedEnvelopeException(String message, Throwable e) {
    super(message, e);
  }
}
