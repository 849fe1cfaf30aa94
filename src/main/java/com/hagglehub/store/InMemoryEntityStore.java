package com.hagglehub.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for development runs and tests. Insertion order is the
 * lookup order.
 */
public class InMemoryEntityStore implements EntityStore {

    private final List<UserRecord> users = new CopyOnWriteArrayList<>();
    private final List<DealerRecord> dealers = new CopyOnWriteArrayList<>();
    private final List<DealRecord> deals = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public UserRecord addUser(UserRecord user) {
        users.add(user);
        return user;
    }

    public DealerRecord addDealer(DealerRecord dealer) {
        dealers.add(dealer);
        return dealer;
    }

    public DealRecord addDeal(DealRecord deal) {
        deals.add(deal);
        return deal;
    }

    public List<DealerRecord> dealers() {
        return List.copyOf(dealers);
    }

    public List<DealRecord> deals() {
        return List.copyOf(deals);
    }

    @Override
    public List<UserRecord> findUsersByAlias(String alias) {
        var out = new ArrayList<UserRecord>();
        for (var u : users) {
            if (Objects.equals(u.alias(), alias)) out.add(u);
        }
        return out;
    }

    @Override
    public List<DealRecord> findDeals(String field, String value, String userId) {
        var out = new ArrayList<DealRecord>();
        for (var d : deals) {
            if (userId != null && !userId.equals(d.userId())) continue;
            if (Objects.equals(d.field(field), value)) out.add(d);
        }
        return out;
    }

    @Override
    public List<DealRecord> listDeals(String userId) {
        var out = new ArrayList<DealRecord>();
        for (var d : deals) {
            if (userId == null || userId.equals(d.userId())) out.add(d);
        }
        return out;
    }

    @Override
    public List<DealerRecord> findDealers(String field, String value) {
        var out = new ArrayList<DealerRecord>();
        for (var d : dealers) {
            if (Objects.equals(d.field(field), value)) out.add(d);
        }
        return out;
    }

    @Override
    public DealRecord findDeal(String dealId) {
        for (var d : deals) {
            if (d.id().equals(dealId)) return d;
        }
        return null;
    }

    @Override
    public DealerRecord createDealer(String name, String emailDomain) {
        return addDealer(new DealerRecord("dealer-" + ids.incrementAndGet(), name, emailDomain));
    }

    @Override
    public DealRecord createDeal(String userId, String dealerId, String title) {
        return addDeal(new DealRecord("deal-" + ids.incrementAndGet(), userId, dealerId,
                "", "", "", DealRecord.STATUS_OPEN, title));
    }
}
