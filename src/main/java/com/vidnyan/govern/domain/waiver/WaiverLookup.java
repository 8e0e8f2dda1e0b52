package com.vidnyan.govern.domain.waiver;

import java.time.Instant;

/**
 * Read side of the waiver layer, consulted once per violation candidate.
 */
@FunctionalInterface
public interface WaiverLookup {

    boolean isWaived(String controlOrPolicyId, String resourceId, Instant now);

    /**
     * Lookup that never waives anything.
     */
    static WaiverLookup none() {
        return (controlOrPolicyId, resourceId, now) -> false;
    }
}
