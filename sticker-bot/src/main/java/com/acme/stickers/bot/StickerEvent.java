package com.acme.stickers.bot;

/**
 * A sticker a user sent to the bot.
 *
 * @param setName short name of the pack the sticker belongs to, or null for a standalone sticker
 */
public record StickerEvent(long userId, long chatId, String setName) {

  public boolean hasSetName() {
    return setName != null && !setName.isBlank();
  }
}
