package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.EntityStore;

/**
 * Token against deal aliases first, then user aliases. A user hit does not end
 * matching; it scopes the strategies that follow.
 */
public class RoutingTokenStrategy implements MatchStrategy {

    public static final String NAME = "routing-token";

    @Override
    public String name() { return NAME; }

    @Override
    public boolean applies(MatchContext ctx) {
        return ctx.identity().hasToken();
    }

    @Override
    public DealRecord match(MatchContext ctx, EntityStore store) {
        var token = ctx.identity().token();
        var deals = store.findDeals(DealRecord.ALIAS, token, null);
        if (!deals.isEmpty()) {
            return deals.get(0);
        }
        var users = store.findUsersByAlias(token);
        if (!users.isEmpty()) {
            ctx.identifyUser(users.get(0));
        }
        return null;
    }
}
