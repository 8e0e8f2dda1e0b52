package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.policy.Policy;

import java.util.List;

/**
 * Bulk scan of many resources against policies, with waivers applied.
 */
public interface ScanResourcesUseCase {

    List<Violation> scanResources(List<Policy> policies, List<Resource> resources);

    /**
     * Scan against every enabled stored policy.
     */
    List<Violation> scanStored(List<Resource> resources);
}
