package com.acme.stickers.core;

import com.acme.stickers.domain.Pack;
import com.acme.stickers.domain.StickerType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message unit passed from the bot to the worker through the submission queue.
 *
 * <p>Field names are the wire contract shared by producer and consumer and must not change.
 */
public record SubmissionEnvelope(
        @JsonProperty("short_name") String shortName,
        @JsonProperty("name") String name,
        @JsonProperty("sticker_type") String stickerType,
        @JsonProperty("link") String link,
        @JsonProperty("user_id") Long userId) {

    /** Builds the envelope for a user submitting the given pack, deriving the link from its short name. */
    public static SubmissionEnvelope of(String shortName, String name, StickerType type, long userId) {
        return new SubmissionEnvelope(shortName, name, type.wireValue(), Pack.linkFor(shortName), userId);
    }

    /**
     * Decodes and validates a queue payload.
     *
     * @throws MalformedEnvelopeException if the payload is not JSON or a required field is missing
     */
    public static SubmissionEnvelope fromJson(String payload) {
        SubmissionEnvelope envelope;
        try {
            envelope = Jsons.fromJson(payload, SubmissionEnvelope.class);
        } catch (PermanentException e) {
            throw new MalformedEnvelopeException(e.getMessage(), e);
        }
        if (envelope == null) {
            throw new MalformedEnvelopeException("Payload decoded to null");
        }
        envelope.validate();
        return envelope;
    }

    public String toJson() {
        return Jsons.toJson(this);
    }

    public StickerType kind() {
        return StickerType.fromWire(stickerType);
    }

    private void validate() {
        requireText("short_name", shortName);
        requireText("name", name);
        requireText("sticker_type", stickerType);
        requireText("link", link);
        if (userId == null) {
            throw new MalformedEnvelopeException("Missing required field: user_id");
        }
        try {
            StickerType.fromWire(stickerType);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException(e.getMessage(), e);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedEnvelopeException("Missing required field: " + field);
        }
    }
}
