package com.hagglehub.resolution;

/**
 * Final placement of a message: attached to a deal, or parked in the inbox of a
 * routing token for manual attachment later.
 */
public record Disposition(
    Kind kind,
    String dealId,
    String dealerId,
    String userId,
    String inboxToken,
    String reason
) {
    public enum Kind { ATTACH, INBOX }

    public static Disposition attach(String dealId, String dealerId, String userId, String reason) {
        return new Disposition(Kind.ATTACH, dealId, nullToEmpty(dealerId), nullToEmpty(userId), "", reason);
    }

    public static Disposition inbox(String token, String reason) {
        return new Disposition(Kind.INBOX, "", "", "", nullToEmpty(token), reason);
    }

    public boolean isAttached() {
        return kind == Kind.ATTACH;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
