package com.example.bugretention.service;

import com.example.bugretention.access.BugReportAccess;
import com.example.bugretention.access.WriteContext;
import com.example.bugretention.models.BugReport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

class InMemoryBugReportAccess implements BugReportAccess {

    private final Map<String, BugReport> reports = new LinkedHashMap<>();
    private int softDeleteCalls;

    @Override
    public Optional<BugReport> findById(String id) {
        return Optional.ofNullable(reports.get(id)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<BugReport> findEligibleForDeletion(String projectId, long cutoffMillis) {
        return reports.values().stream()
                .filter(r -> r.getProjectId().equals(projectId))
                .filter(r -> r.getCreatedAt() < cutoffMillis)
                .filter(r -> !r.isSoftDeleted() && !r.isOnLegalHold())
                .sorted(Comparator.comparing(BugReport::getCreatedAt))
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<BugReport> findByIds(Collection<String> ids) {
        List<BugReport> found = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            findById(id).ifPresent(found::add);
        }
        return found;
    }

    @Override
    public int softDelete(Collection<String> ids, String userId, long deletedAtMillis) {
        softDeleteCalls++;
        int changed = 0;
        for (String id : new LinkedHashSet<>(ids)) {
            BugReport report = reports.get(id);
            if (report == null || report.isSoftDeleted() || report.isOnLegalHold()) {
                continue;
            }
            report.markSoftDeleted(deletedAtMillis, userId);
            changed++;
        }
        return changed;
    }

    @Override
    public List<BugReport> restore(Collection<String> ids) {
        List<BugReport> restored = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            BugReport report = reports.get(id);
            if (report != null && report.isSoftDeleted()) {
                restored.add(report.clearDeletion().toBuilder().build());
            }
        }
        return restored;
    }

    @Override
    public int hardDelete(WriteContext tx, Collection<String> ids) {
        InMemoryWriteTransactions.Tx memoryTx = (InMemoryWriteTransactions.Tx) tx;
        int staged = 0;
        for (String id : new LinkedHashSet<>(ids)) {
            memoryTx.stage(
                    () -> reports.containsKey(id) && !reports.get(id).isOnLegalHold(),
                    () -> reports.remove(id));
            staged++;
        }
        return staged;
    }

    @Override
    public List<BugReport> setLegalHold(Collection<String> ids, boolean hold) {
        List<BugReport> changed = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            BugReport report = reports.get(id);
            if (report != null && report.isOnLegalHold() != hold) {
                report.setLegalHold(hold);
                changed.add(report.toBuilder().build());
            }
        }
        return changed;
    }

    @Override
    public long countLegalHoldReports() {
        return reports.values().stream().filter(BugReport::isOnLegalHold).count();
    }

    @Override
    public BugReport save(BugReport report) {
        reports.put(report.getId(), report.toBuilder().build());
        return report;
    }

    BugReport get(String id) {
        return reports.get(id);
    }

    boolean exists(String id) {
        return reports.containsKey(id);
    }

    int softDeleteCalls() {
        return softDeleteCalls;
    }
}
