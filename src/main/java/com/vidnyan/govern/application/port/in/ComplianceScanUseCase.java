package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.application.port.out.ReportStore.StoredReport;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.compliance.TrendPoint;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;

import java.util.List;

/**
 * Assertion-mode audit of a resource inventory against a control framework.
 */
public interface ComplianceScanUseCase {

    /**
     * Scan the resources, apply active waivers and store the report.
     *
     * @throws com.vidnyan.govern.domain.error.UnknownFrameworkException if the framework is not known
     */
    ComplianceReport scan(String frameworkId, List<Resource> resources, String scope);

    /**
     * Violations of one control of a framework, waivers applied.
     */
    List<Violation> evaluateControl(String frameworkId, String controlId, List<Resource> resources);

    List<TrendPoint> trend(String frameworkId, int limit);

    /**
     * @param frameworkId framework id, or null for every framework
     */
    List<StoredReport> history(String frameworkId, int limit);

    List<ControlFramework> frameworks();
}
