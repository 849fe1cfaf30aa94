package com.hagglehub.shared.model;

import com.hagglehub.resolution.Disposition;

public record ResolvedMessage(
    InboundMessage message,
    ExtractedSignals signals,
    RecipientIdentity identity,
    Disposition disposition,
    String idempotencyKey
) {
    public static ResolvedMessage of(InboundMessage message, ExtractedSignals signals,
                                     RecipientIdentity identity, Disposition disposition) {
        return new ResolvedMessage(message, signals, identity, disposition,
                idempotencyKey(message, identity));
    }

    /**
     * Provider message id when present, otherwise derived from the routing token and
     * the message timestamp so that re-deliveries of the same webhook map to one key.
     */
    public static String idempotencyKey(InboundMessage message, RecipientIdentity identity) {
        if (message.hasMessageId()) return message.messageId();
        var token = identity.hasToken() ? identity.token() : "none";
        return "synthetic:" + token + ":" + message.receivedAt().toEpochMilli();
    }
}
