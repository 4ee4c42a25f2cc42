package com.acme.stickers.bot.telegram;

import com.acme.stickers.bot.ChatReplier;
import com.acme.stickers.bot.StickerSetInfo;
import com.acme.stickers.bot.StickerSetResolver;
import com.acme.stickers.core.TransientException;
import lombok.RequiredArgsConstructor;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.stickers.GetStickerSet;
import org.telegram.telegrambots.meta.api.objects.stickers.StickerSet;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/** Bot API calls behind the sticker handler's collaborator interfaces. */
@RequiredArgsConstructor
public class TelegramChatClient implements StickerSetResolver, ChatReplier {

  private final TelegramClient telegramClient;

  @Override
  public StickerSetInfo resolve(String setName) {
    try {
      StickerSet set = telegramClient.execute(GetStickerSet.builder().name(setName).build());
      return new StickerSetInfo(set.getName(), set.getTitle(), set.getStickerType());
    } catch (TelegramApiException e) {
      throw new TransientException("Failed to get sticker set " + setName + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void reply(long chatId, String text) {
    try {
      telegramClient.execute(
          SendMessage.builder().chatId(String.valueOf(chatId)).text(text).build());
    } catch (TelegramApiException e) {
      throw new TransientException("Failed to send message to chat " + chatId + ": " + e.getMessage(), e);
    }
  }
}
