package com.hagglehub.store;

import java.util.List;

/**
 * Capabilities the router needs from the downstream entity store. Lookups are exact
 * match; result order is whatever the store returns and callers take the first hit.
 * A {@code userId} of null means the lookup is not scoped to a user.
 */
public interface EntityStore {
    List<UserRecord> findUsersByAlias(String alias);
    List<DealRecord> findDeals(String field, String value, String userId);
    List<DealRecord> listDeals(String userId);
    List<DealerRecord> findDealers(String field, String value);
    DealRecord findDeal(String dealId);
    DealerRecord createDealer(String name, String emailDomain);
    DealRecord createDeal(String userId, String dealerId, String title);
}
