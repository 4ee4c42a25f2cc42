package com.acme.stickers.bot.telegram;

import com.acme.stickers.bot.BotMessages;
import com.acme.stickers.bot.ChatReplier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

/**
 * Sends the instruction video shown after /start.
 *
 * <p>The first upload returns a Telegram file id which is kept and reused, so later sends do not
 * upload the file again. A stale id is dropped and the file is uploaded once more.
 */
@Slf4j
public class InstructionVideoSender {

  private final TelegramClient telegramClient;
  private final ChatReplier replier;
  private final Path videoPath;
  private final AtomicReference<String> cachedFileId = new AtomicReference<>();

  public InstructionVideoSender(TelegramClient telegramClient, ChatReplier replier, Path videoPath) {
    this.telegramClient = telegramClient;
    this.replier = replier;
    this.videoPath = videoPath;
  }

  public void send(long chatId) {
    String fileId = cachedFileId.get();
    if (fileId != null) {
      try {
        execute(chatId, new InputFile(fileId));
        log.info("Video sent using cached file_id");
        return;
      } catch (TelegramApiException e) {
        log.warn("Failed to send video with cached file_id: {}. Will upload new.", e.getMessage());
        cachedFileId.compareAndSet(fileId, null);
      }
    }

    if (!Files.isRegularFile(videoPath)) {
      log.warn("Instruction video not found at: {}", videoPath);
      replier.reply(chatId, BotMessages.VIDEO_MISSING);
      return;
    }

    try {
      Message sent = execute(chatId, new InputFile(videoPath.toFile()));
      if (sent != null && sent.getVideo() != null) {
        String uploadedId = sent.getVideo().getFileId();
        cachedFileId.set(uploadedId);
        log.info("Video uploaded and file_id cached: {}...", abbreviate(uploadedId));
      }
    } catch (TelegramApiException e) {
      log.error("Error uploading instruction video: {}", e.getMessage(), e);
      replier.reply(chatId, BotMessages.VIDEO_UNAVAILABLE);
    }
  }

  String cachedFileId() {
    return cachedFileId.get();
  }

  private Message execute(long chatId, InputFile video) throws TelegramApiException {
    return telegramClient.execute(
        SendVideo.builder()
            .chatId(String.valueOf(chatId))
            .video(video)
            .caption(BotMessages.VIDEO_CAPTION)
            .build());
  }

  private static String abbreviate(String fileId) {
    return fileId.length() <= 20 ? fileId : fileId.substring(0, 20);
  }
}
