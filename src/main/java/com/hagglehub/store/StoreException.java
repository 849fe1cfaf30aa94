package com.hagglehub.store;

/** Failure talking to the downstream entity store. Status is 0 for I/O failures. */
public class StoreException extends RuntimeException {

    private final int status;

    public StoreException(String message, int status) {
        super(message);
        this.status = status;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int status() {
        return status;
    }
}
