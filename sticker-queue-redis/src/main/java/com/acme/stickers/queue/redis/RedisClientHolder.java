package com.acme.stickers.queue.redis;

import java.util.function.Supplier;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the Redisson client on first use. {@link Redisson#create} connects eagerly and fails
 * when Redis is down, so creation is deferred until the startup wait probes the queue; a failed
 * attempt leaves the holder empty and the next call tries again.
 */
public class RedisClientHolder implements Supplier<RedissonClient>, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(RedisClientHolder.class);

  private final String address;
  private final Config config;
  private volatile RedissonClient client;

  public RedisClientHolder(String address) {
    this.address = address;
    this.config = new Config();
    this.config.useSingleServer().setAddress(address).setRetryAttempts(3);
  }

  @Override
  public RedissonClient get() {
    RedissonClient current = client;
    if (current == null) {
      synchronized (this) {
        current = client;
        if (current == null) {
          current = Redisson.create(config);
          client = current;
          LOG.info("Redis client connected to {}", address);
        }
      }
    }
    return current;
  }

  @Override
  public synchronized void close() {
    if (client != null) {
      client.shutdown();
      client = null;
      LOG.info("Redis client shut down");
    }
  }
}
