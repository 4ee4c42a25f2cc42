package com.acme.stickers.bot;

/** Looks up the full pack behind a sticker's set name. */
public interface StickerSetResolver {

  /**
   * @throws com.acme.stickers.core.TransientException if the chat platform could not be reached
   */
  StickerSetInfo resolve(String setName);
}
