package com.example.bugretention.service;

/**
 * Run-wide error-rate circuit breaker. Counts are cumulative for the whole run; a project that
 * failed before any report was attempted counts as one attempt and one error.
 */
public class ErrorRateBreaker {

    private final double maxErrorRate;
    private long attempted;
    private long errors;

    public ErrorRateBreaker(double maxErrorRate) {
        this.maxErrorRate = maxErrorRate;
    }

    public void recordReports(int reportsAttempted, int reportErrors) {
        attempted += reportsAttempted;
        errors += reportErrors;
    }

    public void recordProjectFailure() {
        attempted++;
        errors++;
    }

    public double errorRate() {
        return attempted == 0 ? 0.0 : (errors * 100.0) / attempted;
    }

    public boolean isTripped() {
        return attempted > 0 && errorRate() > maxErrorRate;
    }

    public long attempted() {
        return attempted;
    }

    public long errors() {
        return errors;
    }
}
