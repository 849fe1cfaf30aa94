package com.hagglehub.shared.model;

public record ExtractedSignals(
    String vin,
    String counterpartyName,
    String url
) {
    public static ExtractedSignals none() {
        return new ExtractedSignals("", "", "");
    }

    public boolean hasVin() { return !vin.isEmpty(); }

    public boolean hasCounterpartyName() { return !counterpartyName.isEmpty(); }

    public boolean hasUrl() { return !url.isEmpty(); }
}
