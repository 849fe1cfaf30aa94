package com.hagglehub.dispatch;

import com.hagglehub.shared.model.ResolvedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards resolved messages through a {@link DownstreamSink}. Deduplication is left to
 * the store, keyed by {@link ResolvedMessage#idempotencyKey()}.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final DownstreamSink sink;
    private final int retries;
    private final long retryDelayMs;

    public Dispatcher(DownstreamSink sink, int retries, long retryDelayMs) {
        this.sink = sink;
        this.retries = Math.max(0, retries);
        this.retryDelayMs = Math.max(0, retryDelayMs);
    }

    public String sinkId() {
        return sink.id();
    }

    public DispatchOutcome dispatch(ResolvedMessage message) {
        var key = message.idempotencyKey();
        var counter = new int[1];
        try {
            var attempted = ResilientCall.execute(() -> {
                if (counter[0]++ > 0) {
                    log.warn("Retrying {} delivery of {} (attempt {})", sink.id(), key, counter[0]);
                }
                sink.deliver(message);
                return Boolean.TRUE;
            }, retries, retryDelayMs);
            int retried = attempted.attempts() - 1;
            return retried == 0 ? DispatchOutcome.delivered() : DispatchOutcome.deliveredAfterRetry(retried);
        } catch (DownstreamException e) {
            var kind = e.isTransient() ? "transient" : e.isMalformed() ? "malformed-response" : "permanent";
            log.error("Dispatch of {} via {} failed ({}, HTTP {}), disposition={}: {}",
                    key, sink.id(), kind, e.status(), message.disposition(), e.getMessage());
            return DispatchOutcome.failed(Math.max(0, counter[0] - 1), kind + ": " + e.getMessage());
        } catch (Exception e) {
            log.error("Dispatch of {} via {} failed unexpectedly", key, sink.id(), e);
            return DispatchOutcome.failed(Math.max(0, counter[0] - 1), "error: " + e.getMessage());
        }
    }
}
