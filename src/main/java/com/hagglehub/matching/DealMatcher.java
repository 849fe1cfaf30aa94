package com.hagglehub.matching;

import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;
import com.hagglehub.store.EntityStore;
import com.hagglehub.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs match strategies in order; the first deal found wins. A strategy whose lookup
 * fails counts as no match and the next one runs.
 */
public class DealMatcher {

    private static final Logger log = LoggerFactory.getLogger(DealMatcher.class);

    private static final Map<String, Supplier<MatchStrategy>> KNOWN = new LinkedHashMap<>();

    static {
        KNOWN.put(SubjectTagStrategy.NAME, SubjectTagStrategy::new);
        KNOWN.put(RoutingTokenStrategy.NAME, RoutingTokenStrategy::new);
        KNOWN.put(VinStrategy.NAME, VinStrategy::new);
        KNOWN.put(SenderDomainStrategy.NAME, SenderDomainStrategy::new);
        KNOWN.put(UrlStrategy.NAME, UrlStrategy::new);
    }

    private final EntityStore store;
    private final List<MatchStrategy> strategies;

    public DealMatcher(EntityStore store, List<MatchStrategy> strategies) {
        this.store = store;
        this.strategies = List.copyOf(strategies);
    }

    public static DealMatcher fromNames(EntityStore store, List<String> names) {
        var strategies = new ArrayList<MatchStrategy>();
        for (var name : names) {
            var factory = KNOWN.get(name);
            if (factory == null) {
                throw new IllegalArgumentException("Unknown match strategy: " + name);
            }
            strategies.add(factory.get());
        }
        return new DealMatcher(store, strategies);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(MatchStrategy::name).toList();
    }

    public MatchResult match(InboundMessage message, ExtractedSignals signals, RecipientIdentity identity) {
        var ctx = new MatchContext(message, signals, identity);
        for (var strategy : strategies) {
            if (!strategy.applies(ctx)) continue;
            try {
                var deal = strategy.match(ctx, store);
                if (deal != null) {
                    log.debug("Matched deal {} via {}", deal.id(), strategy.name());
                    return MatchResult.deal(deal, ctx.user(), strategy.name());
                }
            } catch (StoreException e) {
                log.warn("Strategy {} lookup failed, trying next: {}", strategy.name(), e.getMessage());
            }
        }
        return ctx.user() != null ? MatchResult.user(ctx.user()) : MatchResult.unmatched();
    }
}
