package com.acme.stickers.domain;

import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A distinct sticker pack, identified by its short name. Created on the first submission that
 * references it and never changed afterwards.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "shortName")
public class Pack {
    public static final String LINK_PREFIX = "https://t.me/addstickers/";

    private final Long id;
    private final String shortName;
    private final String displayName;
    private final StickerType kind;
    private final String link;
    private final Instant createdAt;

    public Pack(
            Long id,
            String shortName,
            String displayName,
            StickerType kind,
            String link,
            Instant createdAt) {
        if (shortName == null || shortName.isBlank()) {
            throw new IllegalArgumentException("Pack short name cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Pack kind cannot be null");
        }
        this.id = id;
        this.shortName = shortName;
        this.displayName = displayName;
        this.kind = kind;
        this.link = link;
        this.createdAt = createdAt;
    }

    public static String linkFor(String shortName) {
        return LINK_PREFIX + shortName;
    }
}
