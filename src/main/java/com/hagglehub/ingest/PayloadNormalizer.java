package com.hagglehub.ingest;

import com.hagglehub.shared.model.InboundMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps provider field names (Mailgun form posts, JSON relays) onto {@link InboundMessage}.
 * Never throws on missing or odd input; absent fields become empty strings.
 */
public class PayloadNormalizer {

    private static final List<String> SENDER_KEYS = List.of("sender", "from");
    private static final List<String> RECIPIENT_KEYS = List.of("recipient", "to");
    private static final List<String> SUBJECT_KEYS = List.of("subject");
    private static final List<String> TEXT_KEYS = List.of("body-plain", "stripped-text", "text");
    private static final List<String> HTML_KEYS = List.of("body-html", "stripped-html", "html");
    private static final List<String> MESSAGE_ID_KEYS = List.of("message-id", "messageid", "message_id");
    private static final List<String> TIMESTAMP_KEYS = List.of("timestamp");

    private final int maxBodyLength;
    private final Clock clock;

    public PayloadNormalizer(int maxBodyLength) {
        this(maxBodyLength, Clock.systemUTC());
    }

    public PayloadNormalizer(int maxBodyLength, Clock clock) {
        this.maxBodyLength = Math.max(0, maxBodyLength);
        this.clock = clock;
    }

    public InboundMessage normalize(Map<String, ?> payload) {
        var fields = lowerCaseKeys(payload);

        var sender = first(fields, SENDER_KEYS);
        var recipient = EmailAddresses.firstAddress(first(fields, RECIPIENT_KEYS));

        return new InboundMessage(
            sender,
            recipient,
            EmailAddresses.localPart(recipient),
            EmailAddresses.domain(recipient),
            cap(first(fields, SUBJECT_KEYS)),
            cap(first(fields, TEXT_KEYS)),
            cap(first(fields, HTML_KEYS)),
            stripBrackets(first(fields, MESSAGE_ID_KEYS)),
            timestamp(first(fields, TIMESTAMP_KEYS))
        );
    }

    private static Map<String, String> lowerCaseKeys(Map<String, ?> payload) {
        var fields = new HashMap<String, String>();
        if (payload == null) return fields;
        payload.forEach((key, value) -> {
            if (key == null) return;
            var text = asText(value);
            // keep the first non-empty value when two keys differ only by case
            fields.merge(key.trim().toLowerCase(Locale.ROOT), text,
                    (existing, incoming) -> existing.isEmpty() ? incoming : existing);
        });
        return fields;
    }

    private static String asText(Object value) {
        if (value == null) return "";
        if (value instanceof List<?>) {
            var list = (List<?>) value;
            return list.isEmpty() || list.get(0) == null ? "" : String.valueOf(list.get(0));
        }
        if (value instanceof String[]) {
            var array = (String[]) value;
            return array.length == 0 || array[0] == null ? "" : array[0];
        }
        return String.valueOf(value);
    }

    private static String first(Map<String, String> fields, List<String> keys) {
        for (var key : keys) {
            var value = fields.get(key);
            if (value != null && !value.isBlank()) return value.trim();
        }
        return "";
    }

    private String cap(String value) {
        return value.length() > maxBodyLength ? value.substring(0, maxBodyLength) : value;
    }

    private static String stripBrackets(String messageId) {
        var id = messageId.trim();
        if (id.startsWith("<") && id.endsWith(">") && id.length() >= 2) {
            id = id.substring(1, id.length() - 1).trim();
        }
        return id;
    }

    private Instant timestamp(String raw) {
        if (!raw.isEmpty()) {
            try {
                var seconds = Double.parseDouble(raw);
                if (Double.isFinite(seconds) && seconds > 0) {
                    return Instant.ofEpochMilli((long) (seconds * 1000));
                }
            } catch (NumberFormatException ignored) {
                // unparseable provider timestamp falls back to the receive clock
            }
        }
        return clock.instant();
    }
}
