package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.model.Resource;

import java.util.List;

/**
 * Port for obtaining the resources to scan.
 * Discovery lives outside the engine; adapters read snapshots produced elsewhere.
 */
public interface ResourceInventory {

    /**
     * Load the current resource snapshot.
     */
    List<Resource> load();
}
