package com.example.bugretention.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.bugretention.access.BugReportAccess;
import com.example.bugretention.models.BugReport;
import com.example.bugretention.models.Project;
import com.example.bugretention.models.RetentionPolicy;
import com.example.bugretention.storage.ArchiveResult;
import com.example.bugretention.storage.StorageArchiver;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class BatchProcessorTest {

    private static final Project PROJECT = Project.builder().id("p1").name("Demo").build();
    private static final RetentionPolicy NO_ARCHIVE = RetentionPolicy.builder()
            .bugReportRetentionDays(30).archiveBeforeDelete(false).build();
    private static final RetentionPolicy ARCHIVE = RetentionPolicy.builder()
            .bugReportRetentionDays(30).archiveBeforeDelete(true).build();

    private BugReportAccess access;
    private StorageArchiver archiver;
    private AuditLogService auditLogService;
    private BatchProcessor processor;

    @BeforeEach
    void setUp() {
        access = mock(BugReportAccess.class);
        archiver = mock(StorageArchiver.class);
        auditLogService = mock(AuditLogService.class);
        when(archiver.strategyName()).thenReturn("deletion");
        when(archiver.deleteReportFiles(any(), any()))
                .thenReturn(new ArchiveResult(1, BatchProcessor.SCREENSHOT_ESTIMATE_BYTES, List.of()));
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("archiver", archiver);
        processor = new BatchProcessor(access, beans.getBeanProvider(StorageArchiver.class), auditLogService,
                RetentionFixtures.CLOCK);
    }

    private static List<BugReport> reports(int count) {
        List<BugReport> reports = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            reports.add(BugReport.builder()
                    .id("r" + i)
                    .projectId("p1")
                    .createdAt(RetentionFixtures.NOW - (40 + i) * RetentionFixtures.DAY)
                    .screenshotUrl("screenshots/r" + i + ".png")
                    .build());
        }
        return reports;
    }

    @Test
    @DisplayName("five eligible reports in slices of two are all deleted")
    void deletesInSlices() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(5));
        when(access.softDelete(anyCollection(), isNull(), anyLong()))
                .thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());

        ProjectBatchResult result = processor.applyForProject(PROJECT, NO_ARCHIVE, 2, new ErrorRateBreaker(5.0), "run");

        assertEquals(5, result.deleted());
        assertTrue(result.errors().isEmpty());
        verify(access, times(3)).softDelete(anyCollection(), isNull(), eq(RetentionFixtures.NOW));
        verify(archiver, never()).archiveReportFiles(any(), any());
        verify(archiver, times(5)).deleteReportFiles(any(), isNull());
        verify(auditLogService, never()).recordArchive(any(), any(), any());
    }

    @Test
    @DisplayName("without archiving the files are still deleted and match the planned estimate")
    void deletesFilesWithoutArchiving() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(2));
        when(access.softDelete(anyCollection(), isNull(), anyLong()))
                .thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());

        ProjectPlan plan = processor.plan(PROJECT, NO_ARCHIVE);
        ProjectBatchResult result = processor.applyForProject(PROJECT, NO_ARCHIVE, 10, new ErrorRateBreaker(5.0), "run");

        assertEquals(plan.reports().size(), result.deleted());
        assertEquals(plan.estimatedBytes(), result.storageFreed());
        assertEquals(204800L, result.storageFreed());
        assertEquals(2, result.screenshotsDeleted());
        assertEquals(0, result.archived());
        verify(archiver).deleteReportFiles("screenshots/r0.png", null);
        verify(archiver).deleteReportFiles("screenshots/r1.png", null);
    }

    @Test
    @DisplayName("a report whose files cannot be deleted is kept and reported")
    void storageDeleteFailureKeepsReport() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(2));
        when(archiver.deleteReportFiles(eq("screenshots/r0.png"), any())).thenReturn(
                new ArchiveResult(0, 0L, List.of(new ArchiveResult.FileError("screenshots/r0.png", "AccessDenied"))));
        when(access.softDelete(anyCollection(), isNull(), anyLong()))
                .thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());

        ProjectBatchResult result = processor.applyForProject(PROJECT, NO_ARCHIVE, 10, new ErrorRateBreaker(100.0), "run");

        assertEquals(1, result.deleted());
        assertEquals("r0", result.errors().get(0).bugReportId());
        assertEquals("Storage delete failed: screenshots/r0.png: AccessDenied", result.errors().get(0).error());
        verify(access).softDelete(eq(List.of("r1")), isNull(), anyLong());
    }

    @Test
    @DisplayName("without any archiver the reports are soft-deleted and no storage is counted")
    void noArchiverLeavesFiles() {
        BatchProcessor withoutArchiver = new BatchProcessor(access,
                new StaticListableBeanFactory().getBeanProvider(StorageArchiver.class), auditLogService,
                RetentionFixtures.CLOCK);
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(2));
        when(access.softDelete(anyCollection(), isNull(), anyLong())).thenReturn(2);

        ProjectBatchResult result = withoutArchiver.applyForProject(PROJECT, NO_ARCHIVE, 10, new ErrorRateBreaker(5.0), "run");

        assertEquals(2, result.deleted());
        assertEquals(0L, result.storageFreed());
        assertEquals(0, result.screenshotsDeleted());
    }

    @Test
    @DisplayName("cutoff is now minus the retention period")
    void cutoff() {
        when(access.findEligibleForDeletion(anyString(), anyLong())).thenReturn(List.of());

        ProjectPlan plan = processor.plan(PROJECT, NO_ARCHIVE);

        assertEquals(RetentionFixtures.NOW - 30 * RetentionFixtures.DAY, plan.cutoffMillis());
        assertTrue(plan.isEmpty());
    }

    @Test
    @DisplayName("a report whose archive fails is kept and reported")
    void archiveFailureKeepsReport() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(3));
        when(archiver.archiveReportFiles(any(), any())).thenReturn(new ArchiveResult(1, 2048L, List.of()));
        when(archiver.archiveReportFiles(eq("screenshots/r1.png"), any())).thenReturn(
                new ArchiveResult(0, 0L, List.of(new ArchiveResult.FileError("screenshots/r1.png", "AccessDenied"))));
        when(access.softDelete(anyCollection(), isNull(), anyLong()))
                .thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());

        ProjectBatchResult result = processor.applyForProject(PROJECT, ARCHIVE, 10, new ErrorRateBreaker(50.0), "run");

        assertEquals(2, result.deleted());
        assertEquals(2, result.archived());
        assertEquals(4096L, result.storageFreed());
        assertEquals(2, result.screenshotsDeleted());
        assertEquals(1, result.errors().size());
        assertEquals("r1", result.errors().get(0).bugReportId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(access).softDelete(ids.capture(), isNull(), anyLong());
        assertEquals(List.of("r0", "r2"), new ArrayList<>(ids.getValue()));
        verify(auditLogService).recordArchive(eq("p1"), eq(List.of("r0", "r2")), any());
    }

    @Test
    @DisplayName("an archiver exception is recorded per report")
    void archiverException() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(1));
        when(archiver.archiveReportFiles(any(), any())).thenThrow(new IllegalStateException("bucket gone"));

        ProjectBatchResult result = processor.applyForProject(PROJECT, ARCHIVE, 10, new ErrorRateBreaker(100.0), "run");

        assertEquals(0, result.deleted());
        assertEquals("Archive failed: bucket gone", result.errors().get(0).error());
        verify(access, never()).softDelete(anyCollection(), any(), anyLong());
        verify(auditLogService, never()).recordSoftDelete(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("archiving without an archiver fails the project")
    void missingArchiver() {
        BatchProcessor withoutArchiver = new BatchProcessor(access,
                new StaticListableBeanFactory().getBeanProvider(StorageArchiver.class), auditLogService,
                RetentionFixtures.CLOCK);
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(1));

        assertThrows(IllegalStateException.class,
                () -> withoutArchiver.applyForProject(PROJECT, ARCHIVE, 10, new ErrorRateBreaker(5.0), "run"));
    }

    @Test
    @DisplayName("a failed slice records each of its reports and later slices still run")
    void sliceFailure() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(4));
        when(access.softDelete(anyCollection(), isNull(), anyLong()))
                .thenThrow(new RuntimeException("throttled"))
                .thenReturn(2);

        ProjectBatchResult result = processor.applyForProject(PROJECT, NO_ARCHIVE, 2, new ErrorRateBreaker(100.0), "run");

        assertEquals(2, result.deleted());
        assertEquals(2, result.errors().size());
        assertEquals("Soft delete failed: throttled", result.errors().get(0).error());
    }

    @Test
    @DisplayName("a tripped breaker stops the remaining slices")
    void breakerStopsSlices() {
        when(access.findEligibleForDeletion(eq("p1"), anyLong())).thenReturn(reports(6));
        when(access.softDelete(anyCollection(), isNull(), anyLong())).thenThrow(new RuntimeException("down"));

        ErrorRateBreaker breaker = new ErrorRateBreaker(5.0);
        ProjectBatchResult result = processor.applyForProject(PROJECT, NO_ARCHIVE, 2, breaker, "run");

        assertTrue(breaker.isTripped());
        assertEquals(2, result.errors().size());
        verify(access, times(1)).softDelete(anyCollection(), isNull(), anyLong());
    }
}
