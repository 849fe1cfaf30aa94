package com.hagglehub.shared.model;

import java.time.Instant;

/**
 * Canonical form of one inbound email webhook. Every string field is non-null;
 * absent values are empty strings.
 */
public record InboundMessage(
    String sender,
    String recipient,
    String recipientLocalPart,
    String recipientDomain,
    String subject,
    String text,
    String html,
    String messageId,
    Instant receivedAt
) {
    public boolean hasMessageId() {
        return !messageId.isBlank();
    }

    public String preview() {
        return text.length() > 120 ? text.substring(0, 120) : text;
    }
}
