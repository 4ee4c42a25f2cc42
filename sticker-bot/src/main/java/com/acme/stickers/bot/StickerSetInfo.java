package com.acme.stickers.bot;

/** Canonical identity of a sticker pack as reported by the chat platform. */
public record StickerSetInfo(String shortName, String title, String stickerType) {}
