package com.acme.stickers.queue.redis;

import static org.assertj.core.api.Assertions.*;

import com.redis.testcontainers.RedisContainer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the queue against a real Redis. Payloads written by another client with RPUSH must be
 * readable, since the bot and the worker only share the list name and the JSON format.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisSubmissionQueueIntegrationTest {

  @Container
  static RedisContainer redis = new RedisContainer(DockerImageName.parse("redis:7-alpine"));

  private RedisClientHolder holder;
  private RedissonSubmissionQueue queue;

  @BeforeEach
  void setup() {
    holder = new RedisClientHolder("redis://" + redis.getHost() + ":" + redis.getFirstMappedPort());
    holder.get().getKeys().flushall();
    queue = new RedissonSubmissionQueue(holder);
  }

  @AfterEach
  void teardown() {
    holder.close();
  }

  @Test
  @DisplayName("payloads come out in the order one producer put them in")
  void testFifo() {
    queue.enqueue("sticker_processing", "first");
    queue.enqueue("sticker_processing", "second");
    queue.enqueue("sticker_processing", "third");

    assertThat(queue.dequeueBlocking("sticker_processing", Duration.ofSeconds(2))).contains("first");
    assertThat(queue.dequeueBlocking("sticker_processing", Duration.ofSeconds(2))).contains("second");
    assertThat(queue.dequeueBlocking("sticker_processing", Duration.ofSeconds(2))).contains("third");
  }

  @Test
  @DisplayName("blocking dequeue on an empty queue times out with empty result")
  void testTimeout() {
    long started = System.nanoTime();

    assertThat(queue.dequeueBlocking("sticker_processing", Duration.ofMillis(1500))).isEmpty();
    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isGreaterThanOrEqualTo(900);
  }

  @Test
  @DisplayName("queues with different names do not share payloads")
  void testNamedQueues() {
    queue.enqueue("a", "for-a");

    assertThat(queue.dequeueBlocking("b", Duration.ofSeconds(1))).isEmpty();
    assertThat(queue.dequeueBlocking("a", Duration.ofSeconds(1))).contains("for-a");
  }

  @Test
  @DisplayName("payload is stored as a plain string in a Redis list")
  void testPlainStringStorage() {
    String json = "{\"short_name\":\"abc123\",\"user_id\":555}";
    queue.enqueue("sticker_processing", json);

    RedissonClient client = holder.get();
    List<Object> raw = client.getList("sticker_processing", StringCodec.INSTANCE).readAll();

    assertThat(raw).containsExactly(json);
  }

  @Test
  @DisplayName("ping succeeds against a running Redis")
  void testPing() {
    assertThatCode(queue::ping).doesNotThrowAnyException();
  }
}
