package com.example.bugretention.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.bugretention.config.RetentionProperties;
import java.util.List;
import java.util.Map;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RetentionNotifierTest {

    private static final String HOOK = "https://hooks.example.com/retention";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private RetentionProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new RetentionProperties();
        properties.getNotifications().setType("webhook");
        properties.getNotifications().setWebhookUrl(HOOK);
        properties.getNotifications().setChannel("#ops");
    }

    private static RetentionResult result() {
        return RetentionResult.builder()
                .projectsProcessed(3)
                .totalDeleted(42)
                .storageFreed(1536)
                .errors(List.of(RetentionError.forProject("p1", "boom", RetentionFixtures.CLOCK.instant())))
                .build();
    }

    @Test
    @DisplayName("byte counts are humanised in powers of 1024")
    void formatBytes() {
        assertEquals("0 Bytes", RetentionNotifier.formatBytes(0));
        assertEquals("500 Bytes", RetentionNotifier.formatBytes(500));
        assertEquals("1 KB", RetentionNotifier.formatBytes(1024));
        assertEquals("1.5 KB", RetentionNotifier.formatBytes(1536));
        assertEquals("2.5 MB", RetentionNotifier.formatBytes(2_621_440));
        assertEquals("12.34s", RetentionNotifier.formatDuration(12_340));
    }

    @Test
    @DisplayName("summary carries the run counters")
    void summary() {
        Map<String, Object> summary = RetentionNotifier.summary(result(), 2000);

        assertEquals(42, summary.get("totalDeleted"));
        assertEquals("1.5 KB", summary.get("storageFreed"));
        assertEquals(1, summary.get("errors"));
        assertEquals("2.00s", summary.get("duration"));
    }

    @Test
    @DisplayName("webhook posts text, channel and summary")
    void webhookPostsSummary() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.channel").value("#ops"))
                .andExpect(jsonPath("$.totalDeleted").value(42))
                .andExpect(jsonPath("$.text").value(Matchers.startsWith("Retention run completed: 42 reports deleted")))
                .andRespond(withSuccess());

        new WebhookRetentionNotifier(restTemplate, properties).notifyCompletion(result(), 2000);

        server.verify();
    }

    @Test
    @DisplayName("webhook delivery failures are logged, not thrown")
    void webhookFailureIsSwallowedIntoLog() {
        server.expect(requestTo(HOOK)).andRespond(withServerError());

        new WebhookRetentionNotifier(restTemplate, properties).notifyError(new IllegalStateException("down"));

        server.verify();
    }

    @Test
    @DisplayName("webhook notifier requires a url")
    void webhookRequiresUrl() {
        properties.getNotifications().setWebhookUrl(" ");

        assertThrows(IllegalStateException.class, () -> new WebhookRetentionNotifier(restTemplate, properties));
    }
}
