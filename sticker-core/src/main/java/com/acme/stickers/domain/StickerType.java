package com.acme.stickers.domain;

import java.util.Locale;

/** Kinds of sticker packs, as named on the queue and in the database. */
public enum StickerType {
    REGULAR("regular"),
    MASK("mask"),
    CUSTOM_EMOJI("custom_emoji");

    private final String wireValue;

    StickerType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static StickerType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (StickerType type : values()) {
                if (type.wireValue.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sticker type: " + value);
    }
}
