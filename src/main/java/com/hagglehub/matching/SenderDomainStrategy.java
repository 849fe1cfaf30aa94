package com.hagglehub.matching;

import com.hagglehub.ingest.EmailAddresses;
import com.hagglehub.store.DealRecord;
import com.hagglehub.store.DealerRecord;
import com.hagglehub.store.EntityStore;

public class SenderDomainStrategy implements MatchStrategy {

    public static final String NAME = "sender-domain";

    @Override
    public String name() { return NAME; }

    @Override
    public boolean applies(MatchContext ctx) {
        return !EmailAddresses.domain(ctx.message().sender()).isEmpty();
    }

    @Override
    public DealRecord match(MatchContext ctx, EntityStore store) {
        var domain = EmailAddresses.domain(ctx.message().sender());
        for (var dealer : store.findDealers(DealerRecord.EMAIL_DOMAIN, domain)) {
            var deals = store.findDeals(DealRecord.DEALER_ID, dealer.id(), ctx.userScope());
            if (!deals.isEmpty()) return deals.get(0);
        }
        return null;
    }
}
