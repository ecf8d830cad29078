package com.retail.herd.transport;

/**
 * The broker could not be reached within the configured number of attempts.
 */
public class TransportUnavailableException extends Exception {

    private final int attempts;

    public TransportUnavailableException(String operation, int attempts, Throwable cause) {
        super(operation + " failed after " + attempts + " attempts: " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
