package com.hagglehub.matching;

import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;
import com.hagglehub.store.UserRecord;

/**
 * Per-message matching state. Confined to the worker resolving that message.
 */
public class MatchContext {

    private final InboundMessage message;
    private final ExtractedSignals signals;
    private final RecipientIdentity identity;
    private UserRecord user;

    public MatchContext(InboundMessage message, ExtractedSignals signals, RecipientIdentity identity) {
        this.message = message;
        this.signals = signals;
        this.identity = identity;
    }

    public InboundMessage message() { return message; }

    public ExtractedSignals signals() { return signals; }

    public RecipientIdentity identity() { return identity; }

    public UserRecord user() { return user; }

    void identifyUser(UserRecord user) {
        this.user = user;
    }

    /** Id used to scope deal lookups, or null when no user is known yet. */
    String userScope() {
        return user == null ? null : user.id();
    }
}
