package com.example.bugretention.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(value = "retention.notifications.type", havingValue = "logging", matchIfMissing = true)
public class LoggingRetentionNotifier implements RetentionNotifier {

    @Override
    public void notifyCompletion(RetentionResult result, long durationMs) {
        log.info("Retention job summary: {}", RetentionNotifier.summary(result, durationMs));
    }

    @Override
    public void notifyError(Throwable error) {
        log.error("Retention job error notification: {}", error.getMessage());
    }
}
