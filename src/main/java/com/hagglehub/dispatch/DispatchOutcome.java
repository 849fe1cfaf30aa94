package com.hagglehub.dispatch;

public record DispatchOutcome(
    Status status,
    int retries,
    String reason
) {
    public enum Status { DELIVERED, DELIVERED_AFTER_RETRY, FAILED }

    public static DispatchOutcome delivered() {
        return new DispatchOutcome(Status.DELIVERED, 0, "");
    }

    public static DispatchOutcome deliveredAfterRetry(int retries) {
        return new DispatchOutcome(Status.DELIVERED_AFTER_RETRY, retries, "");
    }

    public static DispatchOutcome failed(int retries, String reason) {
        return new DispatchOutcome(Status.FAILED, retries, reason);
    }

    public boolean isDelivered() {
        return status != Status.FAILED;
    }
}
