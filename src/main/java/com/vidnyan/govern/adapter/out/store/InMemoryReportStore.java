package com.vidnyan.govern.adapter.out.store;

import com.vidnyan.govern.application.port.out.ReportStore;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.ScoreCalculator;
import com.vidnyan.govern.domain.compliance.TrendPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Report history held in memory, in save order.
 */
public class InMemoryReportStore implements ReportStore {

    static final String ID_PREFIX = "report-";

    protected final List<StoredReport> reports = new ArrayList<>();
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public String save(ComplianceReport report) {
        String id = ID_PREFIX + UUID.randomUUID();
        lock.writeLock().lock();
        try {
            reports.add(new StoredReport(id, report));
            try {
                afterWrite();
            } catch (RuntimeException e) {
                reports.remove(reports.size() - 1);
                throw e;
            }
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredReport> list(String framework, int limit) {
        lock.readLock().lock();
        try {
            List<StoredReport> result = new ArrayList<>();
            for (int i = reports.size() - 1; i >= 0 && result.size() < limit; i--) {
                StoredReport stored = reports.get(i);
                if (framework == null || Objects.equals(stored.report().framework(), framework)) {
                    result.add(stored);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TrendPoint> getTrend(String framework, int limit) {
        List<ComplianceReport> newestFirst = list(framework, limit).stream()
                .map(StoredReport::report)
                .toList();
        List<ComplianceReport> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return ScoreCalculator.trend(oldestFirst);
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return reports.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Hook run under the write lock after every mutation. A failing hook rolls the
     * mutation back before the exception propagates.
     */
    protected void afterWrite() {
    }
}
