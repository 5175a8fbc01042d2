package com.example.bugretention.access;

import com.example.bugretention.models.BugReport;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Narrow storage port for report lifecycle fields. Deleting operations skip rows with
 * {@code legal_hold = true}; every mutating operation reports only the rows it actually changed.
 * A row changed concurrently between read and write is never overwritten with stale values.
 */
public interface BugReportAccess {

    Optional<BugReport> findById(String id);

    /**
     * Finds active reports of a project created strictly before the cutoff, oldest first.
     * Excludes reports on legal hold and reports that are already soft-deleted.
     *
     * @param projectId the project to query
     * @param cutoffMillis reports with created_at less than this value are returned
     * @return eligible reports ordered by created_at ascending
     */
    List<BugReport> findEligibleForDeletion(String projectId, long cutoffMillis);

    List<BugReport> findByIds(Collection<String> ids);

    /**
     * Marks active, non-held reports as deleted.
     *
     * @return number of rows transitioned to soft-deleted; already-deleted rows are not counted
     */
    int softDelete(Collection<String> ids, String userId, long deletedAtMillis);

    /**
     * Clears deletion markers on soft-deleted rows. Active and missing rows are ignored.
     *
     * @return the rows that were restored, as written
     */
    List<BugReport> restore(Collection<String> ids);

    /**
     * Stages permanent removal of the given rows inside {@code tx}. Each delete is conditional on
     * the row still existing and not being on legal hold, so a concurrent hold aborts the whole
     * transaction instead of deleting a held row.
     *
     * @return number of deletes staged
     */
    int hardDelete(WriteContext tx, Collection<String> ids);

    /**
     * @return the rows whose legal hold flag actually changed, as written
     */
    List<BugReport> setLegalHold(Collection<String> ids, boolean hold);

    long countLegalHoldReports();

    BugReport save(BugReport report);
}
