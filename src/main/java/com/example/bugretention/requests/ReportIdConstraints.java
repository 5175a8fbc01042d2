package com.example.bugretention.requests;

final class ReportIdConstraints {

    static final String UUID_PATTERN =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";
    static final int MAX_REPORT_IDS = 100;

    private ReportIdConstraints() {
    }
}
