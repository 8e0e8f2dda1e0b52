package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.compliance.ControlFramework;

import java.util.List;
import java.util.Optional;

/**
 * Port for looking up control frameworks.
 */
public interface FrameworkCatalog {

    Optional<ControlFramework> findById(String frameworkId);

    List<ControlFramework> list();
}
