package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.EntityStore;

public interface MatchStrategy {
    String name();

    /** Whether the message carries the signal this strategy needs. Skipped strategies do no lookups. */
    boolean applies(MatchContext ctx);

    /** The matched deal, or null. May throw {@link com.hagglehub.store.StoreException}. */
    DealRecord match(MatchContext ctx, EntityStore store);
}
