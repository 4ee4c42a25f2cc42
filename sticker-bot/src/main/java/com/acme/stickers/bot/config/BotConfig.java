package com.acme.stickers.bot.config;

/** Telegram settings bound from {@code bot.*}. */
public class BotConfig {

  private String token;
  private String instructionVideoPath = "media/instruction_video.mp4";
  private int handlerThreads = 8;
  private int handlerQueueCapacity = 1000;

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getInstructionVideoPath() {
    return instructionVideoPath;
  }

  public void setInstructionVideoPath(String instructionVideoPath) {
    this.instructionVideoPath = instructionVideoPath;
  }

  public int getHandlerThreads() {
    return handlerThreads;
  }

  public void setHandlerThreads(int handlerThreads) {
    this.handlerThreads = handlerThreads;
  }

  public int getHandlerQueueCapacity() {
    return handlerQueueCapacity;
  }

  public void setHandlerQueueCapacity(int handlerQueueCapacity) {
    this.handlerQueueCapacity = handlerQueueCapacity;
  }
}
