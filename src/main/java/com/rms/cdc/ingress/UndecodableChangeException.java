package com.rms.cdc.ingress;

/**
 * A message on the change stream that can never be turned into a change.
 * Redelivery cannot fix it, so the message is terminated.
 */
public class UndecodableChangeException extends RuntimeException {

    public UndecodableChangeException(String message) {
        super(message);
    }

    public UndecodableChangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
