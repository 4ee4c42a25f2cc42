package com.acme.stickers.worker;

/** What happened to one dequeued payload. */
public enum ProcessingOutcome {
  /** A new submission row was written. */
  RECORDED,
  /** The user had already submitted this pack; nothing was written. */
  DUPLICATE,
  /** The payload could not be decoded and was discarded. */
  MALFORMED,
  /** Recording failed and was rolled back; the payload is dropped. */
  FAILED
}
