package com.acme.stickers.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable FIFO channel between the bot and the worker, addressed by queue name.
 *
 * <p>Delivery is at-least-once from the consumer's point of view: an element popped and then lost
 * before it was recorded is not delivered again. Consumers must apply elements idempotently.
 */
public interface SubmissionQueue {

  /**
   * Appends a payload to the tail of the queue. Returns once the transport has accepted it and
   * never waits for a consumer.
   */
  void enqueue(String queueName, String payload);

  /**
   * Pops the head of the queue, blocking up to {@code timeout}.
   *
   * @return the payload, or empty if nothing arrived before the timeout
   */
  Optional<String> dequeueBlocking(String queueName, Duration timeout);

  /** Round trip to the transport, throwing if it cannot be reached. */
  void ping();
}
