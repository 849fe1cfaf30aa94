package com.hagglehub.store;

public record UserRecord(
    String id,
    String alias,
    String email,
    String fallbackDealId
) {
    public boolean hasFallbackDeal() {
        return fallbackDealId != null && !fallbackDealId.isBlank();
    }
}
