package com.hagglehub.store;

public record DealerRecord(
    String id,
    String name,
    String emailDomain
) {
    public static final String NAME = "name";
    public static final String EMAIL_DOMAIN = "emailDomain";

    String field(String field) {
        switch (field) {
            case NAME: return name;
            case EMAIL_DOMAIN: return emailDomain;
            case "id": return id;
            default: throw new IllegalArgumentException("Unknown dealer field: " + field);
        }
    }
}
