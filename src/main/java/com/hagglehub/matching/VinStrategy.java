package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.EntityStore;

public class VinStrategy implements MatchStrategy {

    public static final String NAME = "vin";

    @Override
    public String name() { return NAME; }

    @Override
    public boolean applies(MatchContext ctx) {
        return ctx.signals().hasVin();
    }

    @Override
    public DealRecord match(MatchContext ctx, EntityStore store) {
        var vin = ctx.signals().vin();
        // store field filters compare exactly, stored VINs may be lowercase
        for (var deal : store.listDeals(ctx.userScope())) {
            if (vin.equalsIgnoreCase(deal.vin())) return deal;
        }
        return null;
    }
}
