package com.example.bugretention.requests;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

final class ReportIds {

    private ReportIds() {
    }

    /**
     * Non-empty, duplicate-free copy in first-seen order.
     */
    static List<String> normalize(Collection<String> reportIds) {
        Objects.requireNonNull(reportIds, "reportIds");
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : reportIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("reportIds must not contain blank values");
            }
            unique.add(id);
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("reportIds must be non-empty");
        }
        return List.copyOf(new ArrayList<>(unique));
    }
}
