package com.hagglehub.matching;

import com.hagglehub.shared.model.ExtractedSignals;
import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;
import com.hagglehub.store.DealRecord;
import com.hagglehub.store.DealerRecord;
import com.hagglehub.store.EntityStore;
import com.hagglehub.store.InMemoryEntityStore;
import com.hagglehub.store.StoreException;
import com.hagglehub.store.UserRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class DealMatcherTest {

    private static final String VIN = "1HGCM82633A004352";

    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        store.addUser(new UserRecord("u1", "ab12cd", "buyer@x.com", ""));
        store.addUser(new UserRecord("u2", "zz99", "other@x.com", ""));
        store.addDealer(new DealerRecord("dl1", "Toyota of Cedar Park", "toyota-cp.com"));
        store.addDeal(new DealRecord("d-alias", "u1", "dl1", "civic-hunt", "", "", "open", "Civic"));
        store.addDeal(new DealRecord("d-vin-u2", "u2", "dl1", "", VIN, "", "open", "Accord (u2)"));
        store.addDeal(new DealRecord("d-vin-u1", "u1", "dl1", "", VIN, "https://dealer.example.com/car/77", "open", "Accord"));
    }

    @Test
    void routingTokenBeatsVinOnDifferentDeals() {
        var result = matcher().match(msg("", ""), signals(VIN, ""), identity("civic-hunt"));
        assertEquals(MatchResult.Kind.MATCHED_DEAL, result.kind());
        assertEquals("d-alias", result.deal().id());
        assertEquals(RoutingTokenStrategy.NAME, result.strategy());
    }

    @Test
    void userTokenScopesVinLookup() {
        var result = matcher().match(msg("", ""), signals(VIN, ""), identity("ab12cd"));
        assertEquals(MatchResult.Kind.MATCHED_DEAL, result.kind());
        assertEquals("d-vin-u1", result.deal().id());
        assertEquals("u1", result.user().id());
        assertEquals(VinStrategy.NAME, result.strategy());
    }

    @Test
    void vinWithoutTokenIsUnscopedAndTakesFirst() {
        var result = matcher().match(msg("", ""), signals(VIN, ""), identity("random"));
        assertEquals("d-vin-u2", result.deal().id());
        assertNull(result.user());
    }

    @Test
    void vinMatchIgnoresStoredCase() {
        var lower = new InMemoryEntityStore();
        lower.addDeal(new DealRecord("d-lower", "u9", "dl1", "", "1hgcm82633a004352", "", "open", ""));
        var result = matcher(lower).match(msg("", "VIN: " + VIN), signals(VIN, ""), identity("random"));
        assertEquals(MatchResult.Kind.MATCHED_DEAL, result.kind());
        assertEquals("d-lower", result.deal().id());
        assertEquals(VinStrategy.NAME, result.strategy());
    }

    @Test
    void lowercaseVinStillScopedToTokenUser() {
        store.addDeal(new DealRecord("d-lower-u2", "u2", "dl1", "", "2t1burhe0jc034567", "", "open", ""));
        var result = matcher().match(msg("", ""), signals("2T1BURHE0JC034567", ""), identity("ab12cd"));
        assertEquals(MatchResult.Kind.MATCHED_USER, result.kind());
        assertEquals("u1", result.user().id());
    }

    @Test
    void senderDomainMatchesDealerDeals() {
        var result = matcher().match(msg("Sales <sales@Toyota-CP.com>", ""), ExtractedSignals.none(), RecipientIdentity.empty());
        assertEquals(SenderDomainStrategy.NAME, result.strategy());
        assertEquals("d-alias", result.deal().id());
    }

    @Test
    void urlContainmentMatch() {
        var result = matcher().match(msg("", ""),
                signals("", "https://dealer.example.com/car/77?utm=mail"), RecipientIdentity.empty());
        assertEquals(UrlStrategy.NAME, result.strategy());
        assertEquals("d-vin-u1", result.deal().id());
    }

    @Test
    void knownUserWithoutDealIsMatchedUser() {
        var result = matcher().match(msg("", ""), ExtractedSignals.none(), identity("zz99"));
        assertEquals(MatchResult.Kind.MATCHED_USER, result.kind());
        assertEquals("u2", result.user().id());
        assertNull(result.deal());
    }

    @Test
    void nothingMatchesIsUnmatched() {
        var result = matcher().match(msg("who@nowhere.org", ""), signals("2T1BURHE0JC034567", "https://x.org"), identity("nobody"));
        assertEquals(MatchResult.Kind.UNMATCHED, result.kind());
    }

    @Test
    void failingLookupFallsThroughToNextStrategy() {
        var failing = mock(EntityStore.class);
        when(failing.findDeals(eq(DealRecord.ALIAS), anyString(), any())).thenThrow(new StoreException("boom", 503));
        when(failing.listDeals(isNull()))
                .thenReturn(List.of(new DealRecord("d-x", "u1", "dl1", "", VIN, "", "open", "")));

        var result = DealMatcher.fromNames(failing, List.of("routing-token", "vin"))
                .match(msg("", ""), signals(VIN, ""), identity("civic-hunt"));

        assertEquals("d-x", result.deal().id());
        assertEquals(VinStrategy.NAME, result.strategy());
    }

    @Test
    void strategiesWithoutSignalsDoNoLookups() {
        var spy = mock(EntityStore.class);
        var result = matcher(spy).match(msg("", ""), ExtractedSignals.none(), RecipientIdentity.empty());
        assertEquals(MatchResult.Kind.UNMATCHED, result.kind());
        verifyNoInteractions(spy);
    }

    @Test
    void disabledStrategyIsSkipped() {
        var result = DealMatcher.fromNames(store, List.of("routing-token"))
                .match(msg("", ""), signals(VIN, ""), identity("random"));
        assertEquals(MatchResult.Kind.UNMATCHED, result.kind());
    }

    @Test
    void subjectTagWhenEnabled() {
        var tagged = new InboundMessage("", "", "", "", "Re: [Deal#d-vin-u2] price", "", "", "", Instant.EPOCH);
        var result = DealMatcher.fromNames(store, List.of("subject-tag", "routing-token"))
                .match(tagged, ExtractedSignals.none(), identity("civic-hunt"));
        assertEquals("d-vin-u2", result.deal().id());
        assertEquals(SubjectTagStrategy.NAME, result.strategy());
    }

    @Test
    void unknownStrategyNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> DealMatcher.fromNames(store, List.of("magic")));
    }

    private DealMatcher matcher() {
        return matcher(store);
    }

    private static DealMatcher matcher(EntityStore s) {
        return DealMatcher.fromNames(s, List.of("routing-token", "vin", "sender-domain", "url"));
    }

    private static InboundMessage msg(String sender, String subject) {
        return new InboundMessage(sender, "", "", "", subject, "", "", "", Instant.EPOCH);
    }

    private static ExtractedSignals signals(String vin, String url) {
        return new ExtractedSignals(vin, "", url);
    }

    private static RecipientIdentity identity(String token) {
        return new RecipientIdentity(token, token, "mail.example.com");
    }
}
