package io.reviewdeck.halo;

public final class HaloApiException extends RuntimeException {
    private final int status;

    public HaloApiException(String message, int status) {
        super(message);
        this.status = status;
    }

    public HaloApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int status() {
        return status;
    }
}
