package com.acme.stickers.bot.config;

import com.acme.stickers.bot.StickerSubmissionHandler;
import com.acme.stickers.bot.telegram.InstructionVideoSender;
import com.acme.stickers.bot.telegram.TelegramBotAdapter;
import com.acme.stickers.bot.telegram.TelegramChatClient;
import com.acme.stickers.config.QueueConfig;
import com.acme.stickers.config.StartupConfig;
import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.spi.SubmissionQueue;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/** Wires the bot's Telegram client, the sticker handler and their config from application.yml. */
@Factory
public class BotBeansFactory {

  @Singleton
  @ConfigurationProperties("queue")
  public QueueConfig queueConfig() {
    return new QueueConfig();
  }

  @Singleton
  @ConfigurationProperties("startup")
  public StartupConfig startupConfig() {
    return new StartupConfig();
  }

  @Singleton
  @ConfigurationProperties("bot")
  public BotConfig botConfig() {
    return new BotConfig();
  }

  @Singleton
  public DependencyWaiter dependencyWaiter(StartupConfig config) {
    return new DependencyWaiter(config);
  }

  @Singleton
  public TelegramClient telegramClient(BotConfig config) {
    return new OkHttpTelegramClient(config.getToken());
  }

  @Singleton
  public TelegramChatClient telegramChatClient(TelegramClient telegramClient) {
    return new TelegramChatClient(telegramClient);
  }

  @Singleton
  public InstructionVideoSender instructionVideoSender(
      TelegramClient telegramClient, TelegramChatClient chatClient, BotConfig config) {
    return new InstructionVideoSender(
        telegramClient, chatClient, Path.of(config.getInstructionVideoPath()));
  }

  @Singleton
  public StickerSubmissionHandler stickerSubmissionHandler(
      TelegramChatClient chatClient, SubmissionQueue queue, QueueConfig queueConfig) {
    return new StickerSubmissionHandler(chatClient, queue, chatClient, queueConfig);
  }

  @Singleton
  @Bean(preDestroy = "stop")
  public TelegramBotAdapter telegramBotAdapter(
      BotConfig config,
      StickerSubmissionHandler handler,
      InstructionVideoSender videoSender,
      TelegramChatClient chatClient) {
    return new TelegramBotAdapter(
        config.getToken(),
        new TelegramBotsLongPollingApplication(),
        handler,
        videoSender,
        chatClient,
        handlerPool(config));
  }

  static ThreadPoolExecutor handlerPool(BotConfig config) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadPoolExecutor(
        config.getHandlerThreads(),
        config.getHandlerThreads(),
        60L,
        TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(config.getHandlerQueueCapacity()),
        r -> new Thread(r, "sticker-handler-" + counter.incrementAndGet()));
  }
}
