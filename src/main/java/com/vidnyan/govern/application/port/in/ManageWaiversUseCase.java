package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.domain.waiver.Waiver;

import java.util.List;

/**
 * Grant, revoke and list waivers.
 */
public interface ManageWaiversUseCase {

    /**
     * Grant a waiver, replacing any existing waiver for the same pair.
     */
    Waiver add(WaiverRequest request);

    boolean remove(String waiverId);

    List<Waiver> listActive();

    List<Waiver> list();

    /**
     * @param expiresInDays null for the configured default
     */
    record WaiverRequest(
        String controlOrPolicyId,
        String resourceId,
        String reason,
        String approvedBy,
        Integer expiresInDays
    ) {}
}
