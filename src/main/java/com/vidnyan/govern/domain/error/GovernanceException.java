package com.vidnyan.govern.domain.error;

/**
 * Base type of every error the engine raises. Evaluation itself never throws;
 * these signal bad references, bad configuration or unavailable stores.
 */
public class GovernanceException extends RuntimeException {

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
