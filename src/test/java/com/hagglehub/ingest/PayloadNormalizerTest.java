package com.hagglehub.ingest;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");
    private final PayloadNormalizer normalizer =
            new PayloadNormalizer(100, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void mapsMailgunFormFields() {
        var msg = normalizer.normalize(Map.of(
                "sender", "sales@toyota-cp.com",
                "recipient", "deals-ab12cd@mail.example.com",
                "subject", "Your quote",
                "body-plain", "Hello there",
                "body-html", "<p>Hello there</p>",
                "Message-Id", "<20260501.abc@mg.example.com>",
                "timestamp", "1777636800"));

        assertEquals("sales@toyota-cp.com", msg.sender());
        assertEquals("deals-ab12cd@mail.example.com", msg.recipient());
        assertEquals("deals-ab12cd", msg.recipientLocalPart());
        assertEquals("mail.example.com", msg.recipientDomain());
        assertEquals("Your quote", msg.subject());
        assertEquals("Hello there", msg.text());
        assertEquals("<p>Hello there</p>", msg.html());
        assertEquals("20260501.abc@mg.example.com", msg.messageId());
        assertEquals(Instant.ofEpochSecond(1777636800L), msg.receivedAt());
    }

    @Test
    void acceptsSynonymsAndInconsistentCasing() {
        var msg = normalizer.normalize(Map.of(
                "From", "Brian <brian@dealer.com>",
                "To", "\"Me\" <deals-xy@mail.example.com>, other@x.com",
                "SUBJECT", "Re: offer",
                "stripped-text", "Counter offer",
                "stripped-html", "<b>Counter offer</b>"));

        assertEquals("Brian <brian@dealer.com>", msg.sender());
        assertEquals("deals-xy@mail.example.com", msg.recipient());
        assertEquals("deals-xy", msg.recipientLocalPart());
        assertEquals("Re: offer", msg.subject());
        assertEquals("Counter offer", msg.text());
        assertEquals("<b>Counter offer</b>", msg.html());
    }

    @Test
    void prefersBodyPlainOverStrippedText() {
        var msg = normalizer.normalize(Map.of("body-plain", "full", "stripped-text", "stripped"));
        assertEquals("full", msg.text());
    }

    @Test
    void firstValueOfMultiValuedFormField() {
        var msg = normalizer.normalize(Map.of("recipient", List.of("deals-1@x.com", "deals-2@x.com")));
        assertEquals("deals-1@x.com", msg.recipient());
    }

    @Test
    void emptyPayloadNormalizesToEmptyStrings() {
        var msg = normalizer.normalize(Map.of());
        assertEquals("", msg.sender());
        assertEquals("", msg.recipient());
        assertEquals("", msg.recipientLocalPart());
        assertEquals("", msg.recipientDomain());
        assertEquals("", msg.subject());
        assertEquals("", msg.text());
        assertEquals("", msg.html());
        assertEquals("", msg.messageId());
        assertEquals(NOW, msg.receivedAt());
    }

    @Test
    void nullPayloadAndNullValuesAreTolerated() {
        assertEquals("", normalizer.normalize(null).sender());

        var payload = new HashMap<String, Object>();
        payload.put("sender", null);
        payload.put("subject", 42);
        var msg = normalizer.normalize(payload);
        assertEquals("", msg.sender());
        assertEquals("42", msg.subject());
    }

    @Test
    void recipientWithoutAtKeepsEmptyParts() {
        var msg = normalizer.normalize(Map.of("recipient", "not-an-address"));
        assertEquals("not-an-address", msg.recipient());
        assertEquals("", msg.recipientLocalPart());
        assertEquals("", msg.recipientDomain());
    }

    @Test
    void truncatesBodiesToConfiguredLength() {
        var longText = "x".repeat(500);
        var msg = normalizer.normalize(Map.of("body-plain", longText, "body-html", longText));
        assertEquals(100, msg.text().length());
        assertEquals(100, msg.html().length());
    }

    @Test
    void truncatesOversizedSubject() {
        var msg = normalizer.normalize(Map.of("subject", "VIN " + "y".repeat(5_000)));
        assertEquals(100, msg.subject().length());
        assertTrue(msg.subject().startsWith("VIN "));
    }

    @Test
    void badTimestampFallsBackToClock() {
        var msg = normalizer.normalize(Map.of("timestamp", "yesterday"));
        assertEquals(NOW, msg.receivedAt());
    }
}
