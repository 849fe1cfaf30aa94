package com.hagglehub.matching;

import com.hagglehub.store.DealRecord;
import com.hagglehub.store.EntityStore;

import java.util.regex.Pattern;

/** Explicit {@code [Deal#id]} tag in the subject, as written by our own outbound mail. */
public class SubjectTagStrategy implements MatchStrategy {

    public static final String NAME = "subject-tag";

    private static final Pattern TAG = Pattern.compile("(?i)\\[Deal#([A-Za-z0-9_-]+)\\]");

    @Override
    public String name() { return NAME; }

    @Override
    public boolean applies(MatchContext ctx) {
        return TAG.matcher(ctx.message().subject()).find();
    }

    @Override
    public DealRecord match(MatchContext ctx, EntityStore store) {
        var m = TAG.matcher(ctx.message().subject());
        if (!m.find()) return null;
        return store.findDeal(m.group(1));
    }
}
