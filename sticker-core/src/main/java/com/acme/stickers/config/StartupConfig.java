package com.acme.stickers.config;

import java.time.Duration;

/** Bounded wait applied to every external dependency before a process starts work. */
public class StartupConfig {

  private int maxAttempts = 30;
  private Duration retryDelay = Duration.ofSeconds(2);

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }
}
