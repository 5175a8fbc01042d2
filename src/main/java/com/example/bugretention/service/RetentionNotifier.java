package com.example.bugretention.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Receives the outcome of scheduled retention runs. Implementations must not throw; a failed
 * notification never fails the run.
 */
public interface RetentionNotifier {

    void notifyCompletion(RetentionResult result, long durationMs);

    void notifyError(Throwable error);

    /**
     * Summary fields shared by all notifiers.
     */
    static Map<String, Object> summary(RetentionResult result, long durationMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectsProcessed", result.projectsProcessed());
        payload.put("totalDeleted", result.totalDeleted());
        payload.put("totalArchived", result.totalArchived());
        payload.put("storageFreed", formatBytes(result.storageFreed()));
        payload.put("errors", result.errors().size());
        payload.put("aborted", result.aborted());
        payload.put("duration", formatDuration(durationMs));
        return payload;
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 Bytes";
        }
        String[] units = {"Bytes", "KB", "MB", "GB", "TB"};
        int i = Math.min((int) (Math.log(bytes) / Math.log(1024)), units.length - 1);
        double value = bytes / Math.pow(1024, i);
        String formatted = String.format(Locale.ROOT, "%.2f", value)
                .replaceAll("0+$", "")
                .replaceAll("\\.$", "");
        return formatted + " " + units[i];
    }

    static String formatDuration(long millis) {
        return String.format(Locale.ROOT, "%.2fs", millis / 1000.0);
    }
}
