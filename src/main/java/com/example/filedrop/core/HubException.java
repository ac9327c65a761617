package com.example.filedrop.core;

/**
 * Base for failures that are reported to an HTTP caller as {@code {detail}}.
 */
public abstract class HubException extends RuntimeException {

    private final int status;

    protected HubException(int status, String message) {
        super(message);
        this.status = status;
    }

    protected HubException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
