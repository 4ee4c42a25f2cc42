package com.acme.stickers.config;

import java.time.Duration;

/** Queue naming and polling settings shared by the bot and the worker. Pure POJO. */
public class QueueConfig {

  public static final String DEFAULT_QUEUE_NAME = "sticker_processing";

  private String name = DEFAULT_QUEUE_NAME;
  private Duration pollTimeout = Duration.ofSeconds(5);
  private int consumers = 1;

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public int getConsumers() {
    return consumers;
  }

  public void setConsumers(int consumers) {
    this.consumers = consumers;
  }
}
