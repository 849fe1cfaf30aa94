package com.hagglehub.dispatch;

/**
 * Failed forward to the downstream store. Status 0 means the request never got an
 * HTTP answer (I/O failure).
 */
public class DownstreamException extends RuntimeException {

    private final int status;
    private final boolean malformed;

    public DownstreamException(String message, int status) {
        this(message, status, false, null);
    }

    public DownstreamException(String message, int status, boolean malformed, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.malformed = malformed;
    }

    public static DownstreamException io(String message, Throwable cause) {
        return new DownstreamException(message, 0, false, cause);
    }

    public static DownstreamException malformed(String message, Throwable cause) {
        return new DownstreamException(message, 200, true, cause);
    }

    public int status() { return status; }

    public boolean isMalformed() { return malformed; }

    /** 5xx answers and I/O failures are worth another attempt; 4xx and malformed bodies are not. */
    public boolean isTransient() {
        if (malformed) return false;
        return status == 0 || status >= 500;
    }
}
