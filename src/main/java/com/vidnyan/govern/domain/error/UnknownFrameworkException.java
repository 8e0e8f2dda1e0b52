package com.vidnyan.govern.domain.error;

import lombok.Getter;

/**
 * A scan referenced a framework id that no catalog knows.
 */
@Getter
public class UnknownFrameworkException extends GovernanceException {

    private final String frameworkId;

    public UnknownFrameworkException(String frameworkId) {
        super("Unknown framework: " + frameworkId);
        this.frameworkId = frameworkId;
    }
}
