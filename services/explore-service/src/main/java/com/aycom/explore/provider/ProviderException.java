package com.aycom.explore.provider;

/**
 * A provider call that did not complete: connection failure, read timeout at the HTTP layer
 * or a non-2xx status.
 */
public class ProviderException extends RuntimeException {
    private final Integer status;

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public ProviderException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public Integer getStatus() {
        return status;
    }
}
