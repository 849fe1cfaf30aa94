package com.hagglehub.shared.config;

public record DispatchConfig(
    String mode,
    int retries,
    long retryDelayMs,
    String functionName
) {
    public static DispatchConfig defaults() {
        return new DispatchConfig("entity", 1, 500, "processInboundEmail");
    }
}
