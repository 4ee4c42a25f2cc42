package com.acme.stickers.worker.config;

import com.acme.stickers.config.DatabaseConfig;
import com.acme.stickers.config.QueueConfig;
import com.acme.stickers.config.StartupConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final QueueConfig queueConfig;
    private final StartupConfig startupConfig;
    private final DatabaseConfig databaseConfig;
    private final String redisAddress;

    public ConfigurationLogger(
            QueueConfig queueConfig,
            StartupConfig startupConfig,
            DatabaseConfig databaseConfig,
            @Property(name = "redis.address", defaultValue = "redis://localhost:6379") String redisAddress) {
        this.queueConfig = queueConfig;
        this.startupConfig = startupConfig;
        this.databaseConfig = databaseConfig;
        this.redisAddress = redisAddress;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Redis ━━━");
        LOG.info("  Address:            {}", redisAddress);
        LOG.info("  Queue:              {}", queueConfig.getName());
        LOG.info("  Poll Timeout:       {} (blocking pop wait before re-checking for stop)", queueConfig.getPollTimeout());
        LOG.info("  Consumers:          {} (loop threads draining the queue)", queueConfig.getConsumers());

        LOG.info("━━━ PostgreSQL ━━━");
        LOG.info("  JDBC URL:           {}", databaseConfig.getJdbcUrl());
        LOG.info("  Username:           {}", databaseConfig.getUsername());
        LOG.info("  Password:           {}", mask(databaseConfig.getPassword()));
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", databaseConfig.getMaximumPoolSize());
        LOG.info("  Connect Timeout:    {}", databaseConfig.getConnectionTimeout());
        LOG.info("  Socket Timeout:     {}", databaseConfig.getSocketTimeout());

        LOG.info("━━━ Startup ━━━");
        LOG.info("  Max Attempts:       {}", startupConfig.getMaxAttempts());
        LOG.info("  Retry Delay:        {}", startupConfig.getRetryDelay());
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }

    static String mask(String secret) {
        return secret == null || secret.isEmpty() ? "<empty>" : "********";
    }
}
