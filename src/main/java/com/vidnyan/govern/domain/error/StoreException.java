package com.vidnyan.govern.domain.error;

/**
 * A durable store could not be read or written. Always propagated; a store failure
 * must never look like "no waiver" or "no reports".
 */
public class StoreException extends GovernanceException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
