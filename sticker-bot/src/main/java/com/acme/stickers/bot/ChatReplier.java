package com.acme.stickers.bot;

public interface ChatReplier {

  void reply(long chatId, String text);
}
