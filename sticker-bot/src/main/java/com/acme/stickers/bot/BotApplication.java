package com.acme.stickers.bot;

import com.acme.stickers.bot.telegram.TelegramBotAdapter;
import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.spi.SubmissionQueue;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bot process. Waits for Redis, then long-polls Telegram and queues every sticker pack users send
 * in.
 */
public class BotApplication {

    private static final Logger LOG = LoggerFactory.getLogger(BotApplication.class);

    public static void main(String[] args) {
        LOG.info("Starting Telegram bot...");
        ApplicationContext context = Micronaut.run(BotApplication.class, args);
        // No embedded server keeps the context alive, so SIGTERM has to close it for @PreDestroy to run.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> closeIfRunning(context), "shutdown"));
        LOG.info("Redis connection: {}", context.getProperty("redis.address", String.class).orElse("redis://localhost:6379"));

        SubmissionQueue queue = context.getBean(SubmissionQueue.class);
        if (!context.getBean(DependencyWaiter.class).await("Redis", queue::ping)) {
            LOG.error("Redis is not available. Exiting.");
            context.close();
            System.exit(1);
        }

        try {
            context.getBean(TelegramBotAdapter.class).start();
        } catch (Exception e) {
            LOG.error("Bot crashed: {}", e.getMessage(), e);
            context.close();
            System.exit(1);
        }
    }

    private static void closeIfRunning(ApplicationContext context) {
        if (context.isRunning()) {
            LOG.info("Shutting down...");
            context.close();
        }
    }
}
