package com.hagglehub.resolution;

import com.hagglehub.ingest.EmailAddresses;
import com.hagglehub.matching.MatchResult;
import com.hagglehub.shared.config.RoutingConfig;
import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;
import com.hagglehub.store.DealRecord;
import com.hagglehub.store.DealerRecord;
import com.hagglehub.store.EntityStore;
import com.hagglehub.store.StoreException;
import com.hagglehub.store.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link MatchResult} into a {@link Disposition}. Creates at most one dealer and
 * one deal per message; dealers are reused by exact, case-sensitive name.
 */
public class ResolutionPolicy {

    private static final Logger log = LoggerFactory.getLogger(ResolutionPolicy.class);

    private final EntityStore store;
    private final RoutingConfig config;

    public ResolutionPolicy(EntityStore store, RoutingConfig config) {
        this.store = store;
        this.config = config;
    }

    public Disposition resolve(MatchResult match, InboundMessage message,
                               ExtractedSignals signals, RecipientIdentity identity) {
        try {
            switch (match.kind()) {
                case MATCHED_DEAL:
                    var deal = match.deal();
                    return Disposition.attach(deal.id(), deal.dealerId(), deal.userId(), "matched:" + match.strategy());
                case MATCHED_USER:
                    return resolveForUser(match.user(), message, signals, identity);
                default:
                    return resolveUnmatched(identity);
            }
        } catch (StoreException e) {
            log.warn("Resolution for token '{}' failed, parking in inbox: {}", identity.token(), e.getMessage());
            return Disposition.inbox(identity.token(), "store-error");
        }
    }

    private Disposition resolveForUser(UserRecord user, InboundMessage message,
                                       ExtractedSignals signals, RecipientIdentity identity) {
        var fallback = fallbackDeal(user, identity);
        if (fallback != null) {
            return Disposition.attach(fallback, "", user.id(), "fallback");
        }
        if (!config.autoCreate()) {
            return Disposition.inbox(identity.token(), "user-without-deal");
        }

        var dealerName = signals.hasCounterpartyName()
                ? signals.counterpartyName()
                : nameFromSender(message.sender());
        if (dealerName.isEmpty()) {
            return Disposition.inbox(identity.token(), "no-counterparty");
        }

        var dealer = findOrCreateDealer(dealerName, dealerDomain(message.sender()));
        var deal = findOrCreateDeal(user, dealer);
        return Disposition.attach(deal.id(), dealer.id(), user.id(), "auto-created");
    }

    private Disposition resolveUnmatched(RecipientIdentity identity) {
        var fallback = config.fallbackDealFor(identity.token());
        if (fallback != null) {
            return Disposition.attach(fallback, "", "", "fallback");
        }
        return Disposition.inbox(identity.token(), "unmatched");
    }

    private String fallbackDeal(UserRecord user, RecipientIdentity identity) {
        if (user.hasFallbackDeal()) return user.fallbackDealId();
        var byUser = config.fallbackDealFor(user.id());
        return byUser != null ? byUser : config.fallbackDealFor(identity.token());
    }

    /** Sender domain to record on a new dealer; empty for shared webmail domains. */
    private String dealerDomain(String sender) {
        var domain = EmailAddresses.domain(sender);
        return config.isFreeMail(domain) ? "" : domain;
    }

    private DealerRecord findOrCreateDealer(String name, String emailDomain) {
        var existing = store.findDealers(DealerRecord.NAME, name);
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        var created = store.createDealer(name, emailDomain);
        log.info("Created dealer '{}' ({})", name, created.id());
        return created;
    }

    private DealRecord findOrCreateDeal(UserRecord user, DealerRecord dealer) {
        for (var deal : store.findDeals(DealRecord.DEALER_ID, dealer.id(), user.id())) {
            if (deal.isOpen()) return deal;
        }
        var created = store.createDeal(user.id(), dealer.id(), "Deal with " + dealer.name());
        log.info("Created deal {} for user {} and dealer '{}'", created.id(), user.id(), dealer.name());
        return created;
    }

    /** "john.smith@dealer.com" becomes "john smith". */
    static String nameFromSender(String sender) {
        var local = EmailAddresses.localPart(sender);
        return local.replaceAll("[._+\\-]+", " ").trim().replaceAll("\\s+", " ");
    }
}
