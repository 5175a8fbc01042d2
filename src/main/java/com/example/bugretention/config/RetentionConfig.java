package com.example.bugretention.config;

import com.example.bugretention.service.ComplianceTables;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class RetentionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ComplianceTables complianceTables(RetentionProperties properties) {
        return ComplianceTables.withTierLimits(properties.getTiers());
    }

    // Single thread: retention runs never overlap.
    @Bean
    public ThreadPoolTaskScheduler retentionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("retention-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
