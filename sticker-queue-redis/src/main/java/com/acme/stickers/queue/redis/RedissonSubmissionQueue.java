package com.acme.stickers.queue.redis;

import com.acme.stickers.core.TransientException;
import com.acme.stickers.spi.SubmissionQueue;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.redisson.api.RBlockingQueue;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubmissionQueue} on a Redis list: producers append with RPUSH, consumers pop with BLPOP.
 * Payloads are stored as plain UTF-8 strings so any Redis client can read them.
 *
 * <p>The client is obtained from a supplier on every call so that a client which could not be
 * created yet surfaces as a {@link TransientException} instead of failing construction.
 */
public class RedissonSubmissionQueue implements SubmissionQueue {
  private static final Logger LOG = LoggerFactory.getLogger(RedissonSubmissionQueue.class);

  private final Supplier<RedissonClient> redisson;

  public RedissonSubmissionQueue(Supplier<RedissonClient> redisson) {
    this.redisson = redisson;
  }

  @Override
  public void enqueue(String queueName, String payload) {
    try {
      queue(queueName).add(payload);
      LOG.debug("Enqueued payload to {}", queueName);
    } catch (RuntimeException e) {
      throw new TransientException("Failed to enqueue to " + queueName + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<String> dequeueBlocking(String queueName, Duration timeout) {
    try {
      return Optional.ofNullable(queue(queueName).poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    } catch (RuntimeException e) {
      throw new TransientException("Failed to dequeue from " + queueName + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void ping() {
    boolean reachable;
    try {
      reachable = redisson.get().getRedisNodes(RedisNodes.SINGLE).pingAll();
    } catch (RuntimeException e) {
      throw new TransientException("Redis unreachable: " + e.getMessage(), e);
    }
    if (!reachable) {
      throw new TransientException("Redis did not answer PING");
    }
  }

  private RBlockingQueue<String> queue(String queueName) {
    return redisson.get().getBlockingQueue(queueName, StringCodec.INSTANCE);
  }
}
