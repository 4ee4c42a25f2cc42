package com.acme.stickers.queue.redis;

import com.acme.stickers.spi.SubmissionQueue;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Wires the Redis client holder and the queue built on it from {@code redis.address}. Setting
 * {@code redis.enabled=false} leaves both out so another {@link SubmissionQueue} can be supplied.
 */
@Factory
@Requires(property = "redis.enabled", notEquals = "false")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "close")
  public RedisClientHolder redisClientHolder(
      @Property(name = "redis.address", defaultValue = "redis://localhost:6379") String address) {
    return new RedisClientHolder(address);
  }

  @Singleton
  public SubmissionQueue submissionQueue(RedisClientHolder holder) {
    return new RedissonSubmissionQueue(holder);
  }
}
