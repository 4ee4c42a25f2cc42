package com.acme.stickers.bot;

/** User facing texts. */
public final class BotMessages {

  public static final String WELCOME =
      "Привет! Это бот для моего мини-проекта, который помогает собирать информацию о стикерпаках!\n\n"
          + "Пожалуйста, пришли мне по одному стикеру из каждого добавленного стикерпака, это займёт всего несколько минут! \n\n"
          + "Данное действие очень сильно мне поможет, спасибо за помощь! 🙏🙏🙏\n\n"
          + "Вот видео пример того, как это делается:";

  public static final String THANKS =
      "Спасибо! Пришли мне ещё стикеры из других стикерпаков, пожалуйста 🙏";

  public static final String NOT_A_PACK = "⚠️ Этот стикер не принадлежит ни одному стикерпаку.";

  public static final String PROCESSING_ERROR =
      "❌ Произошла ошибка при обработке стикера. Пожалуйста, вернитесь позже и попробуйте снова 🙏🙏🙏";

  public static final String VIDEO_CAPTION = "📖 Инструкция по использованию бота";

  public static final String VIDEO_UNAVAILABLE = "⚠️ Видео с инструкцией временно недоступно.";

  public static final String VIDEO_MISSING =
      "⚠️ Видео с инструкцией пока не добавлено.\nНо бот работает - просто отправь стикер!";

  private BotMessages() {}
}
