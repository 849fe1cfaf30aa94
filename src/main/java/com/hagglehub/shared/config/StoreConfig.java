package com.hagglehub.shared.config;

public record StoreConfig(
    String mode,
    String baseUrl,
    String apiKey,
    int timeoutSeconds
) {
    public static StoreConfig defaults() {
        return new StoreConfig("http", "https://app.base44.com/api/apps/hagglehub", "", 10);
    }
}
