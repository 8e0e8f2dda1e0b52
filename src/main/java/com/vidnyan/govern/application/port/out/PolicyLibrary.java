package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.policy.PolicyDraft;

import java.util.List;
import java.util.Optional;

/**
 * Port for the catalog of ready-made policy templates.
 */
public interface PolicyLibrary {

    List<LibraryPolicy> list();

    Optional<LibraryPolicy> findById(String templateId);

    /**
     * Distinct categories, sorted.
     */
    List<String> categories();

    List<LibraryPolicy> listByCategory(String category);

    /**
     * One library entry: descriptive fields plus the draft a policy is created from.
     */
    record LibraryPolicy(String id, String name, String description, String category, PolicyDraft template) {}
}
