package com.vidnyan.govern.domain.error;

import java.time.Duration;

/**
 * A bounded scan did not complete within its timeout.
 */
public class ScanTimeoutException extends GovernanceException {

    public ScanTimeoutException(Duration timeout, Throwable cause) {
        super("Scan did not complete within " + timeout, cause);
    }
}
