package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.UserRecord;

public record MatchResult(
    Kind kind,
    DealRecord deal,
    UserRecord user,
    String strategy
) {
    public enum Kind { MATCHED_DEAL, MATCHED_USER, UNMATCHED }

    public static MatchResult deal(DealRecord deal, UserRecord user, String strategy) {
        return new MatchResult(Kind.MATCHED_DEAL, deal, user, strategy);
    }

    public static MatchResult user(UserRecord user) {
        return new MatchResult(Kind.MATCHED_USER, null, user, RoutingTokenStrategy.NAME);
    }

    public static MatchResult unmatched() {
        return new MatchResult(Kind.UNMATCHED, null, null, "none");
    }
}
