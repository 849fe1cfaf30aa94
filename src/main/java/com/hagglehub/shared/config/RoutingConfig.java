package com.hagglehub.shared.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public record RoutingConfig(
    int maxBodyLength,
    String aliasPrefix,
    boolean autoCreate,
    Map<String, String> fallbackDeals,
    List<String> strategies,
    Set<String> freeMailDomains
) {
    public static final List<String> DEFAULT_STRATEGIES =
            List.of("routing-token", "vin", "sender-domain", "url");

    /** Shared webmail domains; never recorded as a dealer's email domain. */
    public static final Set<String> DEFAULT_FREE_MAIL_DOMAINS = Set.of(
            "gmail.com", "googlemail.com", "yahoo.com", "outlook.com", "hotmail.com", "live.com",
            "msn.com", "icloud.com", "me.com", "aol.com", "proton.me", "protonmail.com", "gmx.com");

    public RoutingConfig(int maxBodyLength, String aliasPrefix, boolean autoCreate,
                         Map<String, String> fallbackDeals, List<String> strategies) {
        this(maxBodyLength, aliasPrefix, autoCreate, fallbackDeals, strategies, DEFAULT_FREE_MAIL_DOMAINS);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(20_000, "deals?-", true, Map.of(), DEFAULT_STRATEGIES);
    }

    /** Fallback deal bound to a user id or routing token, or null. */
    public String fallbackDealFor(String key) {
        if (key == null || key.isEmpty()) return null;
        return fallbackDeals.get(key);
    }

    public boolean isFreeMail(String domain) {
        return domain != null && freeMailDomains.contains(domain.toLowerCase(Locale.ROOT));
    }
}
