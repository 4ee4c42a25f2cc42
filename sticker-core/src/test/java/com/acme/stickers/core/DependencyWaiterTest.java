package com.acme.stickers.core;

import static org.assertj.core.api.Assertions.*;

import com.acme.stickers.config.StartupConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DependencyWaiterTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private DependencyWaiter waiter;

  @BeforeEach
  void setUp() {
    waiter = new DependencyWaiter(3, Duration.ofSeconds(2), sleeps::add);
  }

  @Test
  @DisplayName("should return immediately when the probe succeeds")
  void testSucceedsFirstTime() {
    boolean ready = waiter.await("Redis", () -> {});

    assertThat(ready).isTrue();
    assertThat(sleeps).isEmpty();
  }

  @Test
  @DisplayName("should retry with a fixed delay until the probe succeeds")
  void testSucceedsAfterRetries() {
    // Given - fails twice, then succeeds
    AtomicInteger calls = new AtomicInteger();

    // When
    boolean ready =
        waiter.await(
            "PostgreSQL",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("connection refused");
              }
            });

    // Then
    assertThat(ready).isTrue();
    assertThat(calls).hasValue(3);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  @Test
  @DisplayName("should give up after the configured number of attempts")
  void testExhausted() {
    AtomicInteger calls = new AtomicInteger();

    boolean ready =
        waiter.await(
            "Redis",
            () -> {
              calls.incrementAndGet();
              throw new IllegalStateException("down");
            });

    assertThat(ready).isFalse();
    assertThat(calls).hasValue(3);
    assertThat(sleeps).hasSize(2);
  }

  @Test
  @DisplayName("should stop waiting when interrupted")
  void testInterrupted() {
    DependencyWaiter interrupting =
        new DependencyWaiter(
            5,
            Duration.ofSeconds(1),
            d -> {
              throw new InterruptedException();
            });

    boolean ready =
        interrupting.await(
            "Redis",
            () -> {
              throw new IllegalStateException("down");
            });

    assertThat(ready).isFalse();
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  @DisplayName("should take attempts and delay from StartupConfig")
  void testFromConfig() {
    StartupConfig config = new StartupConfig();
    config.setMaxAttempts(1);
    config.setRetryDelay(Duration.ofMillis(1));

    DependencyWaiter fromConfig = new DependencyWaiter(config);

    assertThat(
            fromConfig.await(
                "Redis",
                () -> {
                  throw new IllegalStateException("down");
                }))
        .isFalse();
  }

  @Test
  @DisplayName("should reject zero attempts")
  void testInvalidAttempts() {
    assertThatThrownBy(() -> new DependencyWaiter(0, Duration.ZERO, d -> {}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
