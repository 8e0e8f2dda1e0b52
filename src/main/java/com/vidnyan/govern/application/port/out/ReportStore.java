package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.TrendPoint;

import java.util.List;

/**
 * Port for compliance report history.
 */
public interface ReportStore {

    /**
     * @return the id assigned to the stored report
     */
    String save(ComplianceReport report);

    /**
     * Newest first.
     *
     * @param framework framework id, or null for every framework
     */
    List<StoredReport> list(String framework, int limit);

    /**
     * The last {@code limit} reports of a framework as trend points, oldest to newest.
     */
    List<TrendPoint> getTrend(String framework, int limit);

    int count();

    record StoredReport(String id, ComplianceReport report) {}
}
