package com.vidnyan.govern.application.service;

import com.vidnyan.govern.application.port.in.ManagePoliciesUseCase;
import com.vidnyan.govern.application.port.in.PolicyLibraryUseCase;
import com.vidnyan.govern.application.port.out.PolicyLibrary;
import com.vidnyan.govern.application.port.out.PolicyLibrary.LibraryPolicy;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyDraft;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyLibraryService implements PolicyLibraryUseCase {

    private final PolicyLibrary policyLibrary;
    private final ManagePoliciesUseCase policies;

    @Override
    public List<LibraryPolicy> list(String category) {
        return category == null || category.isBlank()
                ? policyLibrary.list()
                : policyLibrary.listByCategory(category);
    }

    @Override
    public List<String> categories() {
        return policyLibrary.categories();
    }

    @Override
    public Policy importTemplate(String templateId, String overrideId) {
        LibraryPolicy entry = policyLibrary.findById(templateId)
                .orElseThrow(() -> new UnknownPolicyException("Unknown library template: " + templateId, templateId));

        // template ids name the template, not the stored policy
        PolicyDraft draft = entry.template().withId(overrideId);
        Policy policy = policies.save(draft);
        log.info("Imported library template {} as policy {}", templateId, policy.id());
        return policy;
    }
}
