package com.acme.stickers.bot;

/** Result of handling one sticker event. */
public enum HandlerResult {
  QUEUED,
  NO_PACK,
  FAILED
}
