package com.hagglehub.store;

public record DealRecord(
    String id,
    String userId,
    String dealerId,
    String alias,
    String vin,
    String url,
    String status,
    String title
) {
    public static final String ALIAS = "alias";
    public static final String VIN = "vin";
    public static final String DEALER_ID = "dealerId";
    public static final String URL = "url";
    public static final String STATUS_OPEN = "open";

    public boolean isOpen() {
        return STATUS_OPEN.equalsIgnoreCase(status);
    }

    String field(String field) {
        switch (field) {
            case ALIAS: return alias;
            case VIN: return vin;
            case DEALER_ID: return dealerId;
            case URL: return url;
            case "userId": return userId;
            case "status": return status;
            case "id": return id;
            default: throw new IllegalArgumentException("Unknown deal field: " + field);
        }
    }
}
