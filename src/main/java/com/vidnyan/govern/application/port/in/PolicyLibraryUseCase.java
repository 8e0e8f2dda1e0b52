package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.application.port.out.PolicyLibrary.LibraryPolicy;
import com.vidnyan.govern.domain.policy.Policy;

import java.util.List;

/**
 * Browse the policy library and turn templates into stored policies.
 */
public interface PolicyLibraryUseCase {

    /**
     * @param category category to filter on, or null for all templates
     */
    List<LibraryPolicy> list(String category);

    List<String> categories();

    /**
     * Create a policy from a template and store it.
     *
     * @param overrideId id for the new policy, or null to generate one
     * @throws com.vidnyan.govern.domain.error.UnknownPolicyException if no template has that id
     */
    Policy importTemplate(String templateId, String overrideId);
}
