package com.acme.stickers.bot.telegram;

import com.acme.stickers.bot.BotMessages;
import com.acme.stickers.bot.ChatReplier;
import com.acme.stickers.bot.StickerEvent;
import com.acme.stickers.bot.StickerSubmissionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Long polling entry point. Updates arrive on the polling thread and are handed to a bounded
 * pool, so a slow Bot API call for one user does not hold up the others.
 */
@Slf4j
public class TelegramBotAdapter implements LongPollingSingleThreadUpdateConsumer {

  private static final String START_COMMAND = "/start";

  private final String token;
  private final TelegramBotsLongPollingApplication botsApplication;
  private final StickerSubmissionHandler stickerHandler;
  private final InstructionVideoSender videoSender;
  private final ChatReplier replier;
  private final ExecutorService executor;
  private final Object lifecycleLock = new Object();
  private volatile boolean running;

  public TelegramBotAdapter(
      String token,
      TelegramBotsLongPollingApplication botsApplication,
      StickerSubmissionHandler stickerHandler,
      InstructionVideoSender videoSender,
      ChatReplier replier,
      ExecutorService executor) {
    this.token = token;
    this.botsApplication = botsApplication;
    this.stickerHandler = stickerHandler;
    this.videoSender = videoSender;
    this.replier = replier;
    this.executor = executor;
  }

  public void start() throws TelegramApiException {
    synchronized (lifecycleLock) {
      if (running) {
        log.debug("Telegram bot already running");
        return;
      }
      if (token == null || token.isBlank()) {
        throw new IllegalStateException("bot.token is not configured");
      }
      botsApplication.registerBot(token, this);
      running = true;
      log.info("Telegram bot started, polling for updates");
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      running = false;
      try {
        botsApplication.close();
      } catch (Exception e) {
        log.error("Error stopping Telegram long polling", e);
      }
      executor.shutdown();
      try {
        if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
      log.info("Telegram bot stopped");
    }
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public void consume(Update update) {
    if (!update.hasMessage()) {
      return;
    }
    Message message = update.getMessage();
    if (message.hasSticker() && message.getFrom() != null) {
      StickerEvent event =
          new StickerEvent(
              message.getFrom().getId(), message.getChatId(), message.getSticker().getSetName());
      dispatch(() -> stickerHandler.handle(event));
    } else if (message.hasText() && isStartCommand(message.getText())) {
      long chatId = message.getChatId();
      dispatch(() -> greet(chatId));
    }
  }

  void greet(long chatId) {
    try {
      replier.reply(chatId, BotMessages.WELCOME);
      videoSender.send(chatId);
    } catch (RuntimeException e) {
      log.error("Failed to greet chat {}: {}", chatId, e.getMessage(), e);
    }
  }

  static boolean isStartCommand(String text) {
    String trimmed = text.trim();
    return trimmed.equals(START_COMMAND)
        || trimmed.startsWith(START_COMMAND + " ")
        || trimmed.startsWith(START_COMMAND + "@");
  }

  private void dispatch(Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      log.warn("Dropping update, handler pool is saturated or shut down");
    }
  }
}
