package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.EntityStore;

/** A deal matches when its stored listing URL is contained in the extracted URL. */
public class UrlStrategy implements MatchStrategy {

    public static final String NAME = "url";

    @Override
    public String name() { return NAME; }

    @Override
    public boolean applies(MatchContext ctx) {
        return ctx.signals().hasUrl();
    }

    @Override
    public DealRecord match(MatchContext ctx, EntityStore store) {
        var url = ctx.signals().url();
        for (var deal : store.listDeals(ctx.userScope())) {
            var stored = deal.url();
            if (stored != null && !stored.isBlank() && url.contains(stored)) return deal;
        }
        return null;
    }
}
