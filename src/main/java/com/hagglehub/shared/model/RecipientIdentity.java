package com.hagglehub.shared.model;

/**
 * Routing identity derived from a recipient address. An empty token means the
 * message carries no routing hint; it is not an error.
 */
public record RecipientIdentity(
    String token,
    String localPart,
    String domain
) {
    public static RecipientIdentity empty() {
        return new RecipientIdentity("", "", "");
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }
}
