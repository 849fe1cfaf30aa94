package com.hagglehub.dispatch;

import java.util.concurrent.Callable;

/**
 * Fixed-delay retry limited to transient downstream failures.
 */
public class ResilientCall {

    public static <T> Attempted<T> execute(Callable<T> action, int maxRetries, long delayMs) throws Exception {
        Exception last = null;
        int attempt = 0;
        while (attempt <= maxRetries) {
            attempt++;
            try {
                return new Attempted<>(action.call(), attempt);
            } catch (Exception e) {
                last = e;
                if (!isRetryable(e) || attempt > maxRetries) break;
                if (!sleep(delayMs)) break;
            }
        }
        throw last;
    }

    static boolean isRetryable(Exception e) {
        return e instanceof DownstreamException && ((DownstreamException) e).isTransient();
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public record Attempted<T>(T value, int attempts) {}
}
