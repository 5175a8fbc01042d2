package com.example.bugretention.service;

import com.example.bugretention.config.RetentionProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts a Slack-compatible JSON message ({@code text}, optional {@code channel}, plus the run
 * summary) to {@code retention.notifications.webhook-url}.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "retention.notifications.type", havingValue = "webhook")
public class WebhookRetentionNotifier implements RetentionNotifier {

    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final String channel;

    public WebhookRetentionNotifier(RestTemplateBuilder restTemplateBuilder, RetentionProperties properties) {
        this(restTemplateBuilder.build(), properties);
    }

    WebhookRetentionNotifier(RestTemplate restTemplate, RetentionProperties properties) {
        String url = properties.getNotifications().getWebhookUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("retention.notifications.webhook-url is required for webhook notifications");
        }
        this.restTemplate = restTemplate;
        this.webhookUrl = url;
        this.channel = properties.getNotifications().getChannel();
    }

    @Override
    public void notifyCompletion(RetentionResult result, long durationMs) {
        Map<String, Object> summary = RetentionNotifier.summary(result, durationMs);
        String text = String.format("Retention run %s: %s reports deleted across %s projects, %s freed, %s errors",
                result.aborted() ? "aborted" : "completed",
                summary.get("totalDeleted"), summary.get("projectsProcessed"),
                summary.get("storageFreed"), summary.get("errors"));
        post(text, summary);
    }

    @Override
    public void notifyError(Throwable error) {
        post("Retention run failed: " + error.getMessage(), Map.of());
    }

    private void post(String text, Map<String, Object> fields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        if (channel != null && !channel.isBlank()) {
            body.put("channel", channel);
        }
        body.putAll(fields);
        try {
            restTemplate.postForEntity(webhookUrl, body, String.class);
        } catch (RestClientException ex) {
            log.error("Failed to deliver retention notification: {}", ex.getMessage());
        }
    }
}
