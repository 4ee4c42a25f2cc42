package com.acme.stickers.bot;

import com.acme.stickers.config.QueueConfig;
import com.acme.stickers.core.SubmissionEnvelope;
import com.acme.stickers.domain.StickerType;
import com.acme.stickers.spi.SubmissionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a sticker event into a queued submission. Deduplication is left to the worker, so every
 * sticker that belongs to a pack is enqueued exactly once per event.
 */
@Slf4j
@RequiredArgsConstructor
public class StickerSubmissionHandler {

  private final StickerSetResolver resolver;
  private final SubmissionQueue queue;
  private final ChatReplier replier;
  private final QueueConfig queueConfig;

  public HandlerResult handle(StickerEvent event) {
    if (!event.hasSetName()) {
      safeReply(event.chatId(), BotMessages.NOT_A_PACK);
      return HandlerResult.NO_PACK;
    }

    try {
      StickerSetInfo set = resolver.resolve(event.setName());
      SubmissionEnvelope envelope =
          SubmissionEnvelope.of(
              set.shortName(), set.title(), StickerType.fromWire(set.stickerType()), event.userId());
      queue.enqueue(queueConfig.getName(), envelope.toJson());
      log.info(
          "Queued sticker pack '{}', '{}' from user {}",
          set.title(),
          set.shortName(),
          event.userId());
    } catch (RuntimeException e) {
      log.error(
          "Error handling sticker from set {} for user {}: {}",
          event.setName(),
          event.userId(),
          e.getMessage(),
          e);
      safeReply(event.chatId(), BotMessages.PROCESSING_ERROR);
      return HandlerResult.FAILED;
    }

    safeReply(event.chatId(), BotMessages.THANKS);
    return HandlerResult.QUEUED;
  }

  private void safeReply(long chatId, String text) {
    try {
      replier.reply(chatId, text);
    } catch (RuntimeException e) {
      log.warn("Failed to reply to chat {}: {}", chatId, e.getMessage());
    }
  }
}
