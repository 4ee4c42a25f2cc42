package com.acme.stickers.worker;

import com.acme.stickers.config.QueueConfig;
import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.core.MalformedEnvelopeException;
import com.acme.stickers.core.SubmissionEnvelope;
import com.acme.stickers.repository.RecordResult;
import com.acme.stickers.repository.SubmissionStore;
import com.acme.stickers.spi.SubmissionQueue;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains the submission queue into the submission store.
 *
 * <p>Each loop thread blocks on the queue for at most the configured poll timeout, so a stop
 * request is noticed within one timeout. An item that has been dequeued always runs to commit or
 * rollback before the thread checks the stop flag again. No single item can end the loop.
 */
@Slf4j
@Singleton
public class SubmissionConsumer {

  private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(30);

  private final SubmissionQueue queue;
  private final SubmissionStore store;
  private final QueueConfig config;
  private final Duration errorBackoff;
  private final DependencyWaiter.Sleeper sleeper;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final List<Thread> threads = new ArrayList<>();

  @Inject
  public SubmissionConsumer(SubmissionQueue queue, SubmissionStore store, QueueConfig config) {
    this(queue, store, config, Duration.ofSeconds(1), d -> Thread.sleep(d.toMillis()));
  }

  SubmissionConsumer(
      SubmissionQueue queue,
      SubmissionStore store,
      QueueConfig config,
      Duration errorBackoff,
      DependencyWaiter.Sleeper sleeper) {
    this.queue = queue;
    this.store = store;
    this.config = config;
    this.errorBackoff = errorBackoff;
    this.sleeper = sleeper;
  }

  /** Starts {@code queue.consumers} loop threads. Calling it on a running consumer is a no-op. */
  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    int consumers = Math.max(1, config.getConsumers());
    for (int i = 1; i <= consumers; i++) {
      Thread thread = new Thread(this::run, "submission-consumer-" + i);
      threads.add(thread);
      thread.start();
    }
    log.info("Worker ready. Listening to queue: {} with {} consumer(s)", config.getName(), consumers);
  }

  /** Asks every loop thread to finish its current item and waits for them to exit. */
  @PreDestroy
  public synchronized void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    log.info("Stopping submission consumer");
    for (Thread thread : threads) {
      try {
        thread.join(JOIN_TIMEOUT.toMillis());
        if (thread.isAlive()) {
          log.warn("Consumer thread {} did not stop within {}", thread.getName(), JOIN_TIMEOUT);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for {} to stop", thread.getName());
        break;
      }
    }
    threads.clear();
  }

  public boolean isRunning() {
    return running.get();
  }

  void run() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        pollOnce();
      } catch (RuntimeException e) {
        log.error("Error processing task: {}", e.getMessage(), e);
        pause();
      }
    }
    log.info("Consumer loop {} exited", Thread.currentThread().getName());
  }

  /**
   * Waits up to the poll timeout for one payload and processes it.
   *
   * @return the outcome, or empty if the queue stayed empty
   */
  public Optional<ProcessingOutcome> pollOnce() {
    return queue
        .dequeueBlocking(config.getName(), config.getPollTimeout())
        .map(this::process);
  }

  /** Decodes and records a single payload. Never throws. */
  public ProcessingOutcome process(String payload) {
    SubmissionEnvelope envelope;
    try {
      envelope = SubmissionEnvelope.fromJson(payload);
    } catch (MalformedEnvelopeException e) {
      log.error("Discarding malformed payload: {} (payload: {})", e.getMessage(), payload);
      return ProcessingOutcome.MALFORMED;
    }

    log.info("Processing task: {}", envelope.shortName());
    try {
      RecordResult result = store.record(envelope);
      if (result.isNewSubmission()) {
        log.info("Successfully processed sticker pack submission");
        return ProcessingOutcome.RECORDED;
      }
      return ProcessingOutcome.DUPLICATE;
    } catch (RuntimeException e) {
      log.error(
          "Error processing sticker pack {} for user {}: {}",
          envelope.shortName(),
          envelope.userId(),
          e.getMessage(),
          e);
      return ProcessingOutcome.FAILED;
    }
  }

  private void pause() {
    try {
      sleeper.sleep(errorBackoff);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
