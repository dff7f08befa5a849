package com.rms.cdc.core.error;

/**
 * A delivery key could not be derived for a change: the row has no {@code id}
 * column, or a key token is not representable under the configured policy.
 *
 * <p>Scoped to a single change; nothing is written for it.</p>
 */
public class KeyDerivationException extends RuntimeException {

    public KeyDerivationException(String message) {
        super(message);
    }
}
