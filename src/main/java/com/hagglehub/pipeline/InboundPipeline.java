package com.hagglehub.pipeline;

import com.hagglehub.dispatch.DispatchOutcome;
import com.hagglehub.dispatch.Dispatcher;
import com.hagglehub.ingest.IdentityExtractor;
import com.hagglehub.ingest.SignalExtractor;
import com.hagglehub.matching.DealMatcher;
import com.hagglehub.observability.MetricsConfig;
import com.hagglehub.resolution.Disposition;
import com.hagglehub.resolution.ResolutionPolicy;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.ResolvedMessage;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs everything after normalization on a worker pool, detached from the webhook
 * request. Every failure is logged here; none reach the caller.
 */
public class InboundPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InboundPipeline.class);

    private final IdentityExtractor identityExtractor;
    private final SignalExtractor signalExtractor;
    private final DealMatcher matcher;
    private final ResolutionPolicy policy;
    private final Dispatcher dispatcher;
    private final MetricsConfig metrics;
    private final ExecutorService executor;

    public InboundPipeline(IdentityExtractor identityExtractor, SignalExtractor signalExtractor,
                           DealMatcher matcher, ResolutionPolicy policy, Dispatcher dispatcher,
                           MetricsConfig metrics, ExecutorService executor) {
        this.identityExtractor = identityExtractor;
        this.signalExtractor = signalExtractor;
        this.matcher = matcher;
        this.policy = policy;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Queues the message and returns immediately. The future completes with the dispatch
     * outcome, or null when the message could not be processed at all.
     */
    public CompletableFuture<DispatchOutcome> submit(InboundMessage message) {
        try {
            return CompletableFuture.supplyAsync(() -> runSafely(message), executor);
        } catch (RejectedExecutionException e) {
            log.error("Pipeline rejected message {} to {}: {}", message.messageId(), message.recipient(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private DispatchOutcome runSafely(InboundMessage message) {
        try {
            return process(message);
        } catch (RuntimeException e) {
            log.error("Processing of message {} to {} failed", message.messageId(), message.recipient(), e);
            return null;
        }
    }

    /** Resolves and dispatches one message on the calling thread. */
    public DispatchOutcome process(InboundMessage message) {
        var sample = Timer.start(metrics.registry());

        var identity = identityExtractor.identify(message);
        var signals = signalExtractor.extract(message);
        var match = matcher.match(message, signals, identity);
        metrics.matches(match.strategy()).increment();

        Disposition disposition = policy.resolve(match, message, signals, identity);
        metrics.dispositions(disposition.kind().name(), disposition.reason()).increment();
        sample.stop(metrics.resolutionLatency());

        var resolved = ResolvedMessage.of(message, signals, identity, disposition);
        var outcome = dispatcher.dispatch(resolved);
        metrics.dispatches(outcome.status().name()).increment();

        if (outcome.isDelivered()) {
            log.info("Dispatched {} token='{}' vin='{}' -> {} {} ({}, retries={})",
                    resolved.idempotencyKey(), identity.token(), signals.vin(),
                    disposition.kind(), disposition.isAttached() ? disposition.dealId() : disposition.inboxToken(),
                    disposition.reason(), outcome.retries());
        } else {
            log.warn("Message {} received but not stored ({}); preview: {}",
                    resolved.idempotencyKey(), outcome.reason(), message.preview());
        }
        return outcome;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Pipeline workers still busy after 30s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
