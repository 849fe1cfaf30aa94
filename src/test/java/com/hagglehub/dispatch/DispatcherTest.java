package com.hagglehub.dispatch;

import com.hagglehub.resolution.Disposition;
import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;
import com.hagglehub.shared.model.ResolvedMessage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    static class ScriptedSink implements DownstreamSink {
        final List<Integer> statuses;
        final List<String> keys = new ArrayList<>();

        ScriptedSink(Integer... statuses) {
            this.statuses = new ArrayList<>(List.of(statuses));
        }

        @Override public String id() { return "scripted"; }

        @Override
        public void deliver(ResolvedMessage message) {
            keys.add(message.idempotencyKey());
            int status = statuses.isEmpty() ? 200 : statuses.remove(0);
            if (status >= 300) throw new DownstreamException("HTTP " + status, status);
        }
    }

    @Test
    void deliversFirstTime() {
        var sink = new ScriptedSink(200);
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.DELIVERED, outcome.status());
        assertEquals(1, sink.keys.size());
    }

    @Test
    void retriesExactlyOnceOnServerError() {
        var sink = new ScriptedSink(500, 500, 500);
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.FAILED, outcome.status());
        assertEquals(2, sink.keys.size());
        assertEquals(1, outcome.retries());
        assertTrue(outcome.reason().startsWith("transient"));
    }

    @Test
    void recoversAfterOneRetry() {
        var sink = new ScriptedSink(500, 201);
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.DELIVERED_AFTER_RETRY, outcome.status());
        assertEquals(1, outcome.retries());
        assertEquals(List.of("m-1", "m-1"), sink.keys);
    }

    @Test
    void noRetryOnClientError() {
        var sink = new ScriptedSink(400, 200);
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.FAILED, outcome.status());
        assertEquals(1, sink.keys.size());
        assertEquals(0, outcome.retries());
        assertTrue(outcome.reason().startsWith("permanent"));
    }

    @Test
    void noRetryOnMalformedResponse() {
        var calls = new int[1];
        DownstreamSink sink = new DownstreamSink() {
            @Override public String id() { return "bad-json"; }
            @Override public void deliver(ResolvedMessage m) {
                calls[0]++;
                throw DownstreamException.malformed("not json", null);
            }
        };
        var outcome = new Dispatcher(sink, 3, 1).dispatch(resolved("m-1"));
        assertFalse(outcome.isDelivered());
        assertEquals(1, calls[0]);
    }

    @Test
    void retriesOnceAfterIoFailure() {
        var calls = new int[1];
        DownstreamSink sink = new DownstreamSink() {
            @Override public String id() { return "flaky-network"; }
            @Override public void deliver(ResolvedMessage m) {
                if (calls[0]++ == 0) throw DownstreamException.io("connection reset", new IOException("reset"));
            }
        };
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.DELIVERED_AFTER_RETRY, outcome.status());
        assertEquals(2, calls[0]);
    }

    @Test
    void ioFailureOnEveryAttemptIsTransientFailure() {
        var calls = new int[1];
        DownstreamSink sink = new DownstreamSink() {
            @Override public String id() { return "offline"; }
            @Override public void deliver(ResolvedMessage m) {
                calls[0]++;
                throw DownstreamException.io("connection refused", new IOException("refused"));
            }
        };
        var outcome = new Dispatcher(sink, 1, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.FAILED, outcome.status());
        assertEquals(2, calls[0]);
        assertTrue(outcome.reason().startsWith("transient"));
    }

    @Test
    void retryCountIsConfigurable() {
        var sink = new ScriptedSink(503, 503, 503, 200);
        var outcome = new Dispatcher(sink, 3, 1).dispatch(resolved("m-1"));
        assertEquals(DispatchOutcome.Status.DELIVERED_AFTER_RETRY, outcome.status());
        assertEquals(3, outcome.retries());
    }

    @Test
    void unexpectedSinkErrorIsReportedNotThrown() {
        DownstreamSink sink = new DownstreamSink() {
            @Override public String id() { return "broken"; }
            @Override public void deliver(ResolvedMessage m) { throw new IllegalStateException("bug"); }
        };
        var outcome = assertDoesNotThrow(() -> new Dispatcher(sink, 1, 1).dispatch(resolved("m-1")));
        assertEquals(DispatchOutcome.Status.FAILED, outcome.status());
    }

    static ResolvedMessage resolved(String messageId) {
        var msg = new InboundMessage("a@b.com", "deals-ab12cd@mail.example.com", "deals-ab12cd",
                "mail.example.com", "Hi", "Body", "", messageId, Instant.parse("2026-01-01T00:00:00Z"));
        return ResolvedMessage.of(msg, ExtractedSignals.none(),
                new RecipientIdentity("ab12cd", "deals-ab12cd", "mail.example.com"),
                Disposition.attach("d1", "dl1", "u1", "matched:vin"));
    }
}
