package com.example.bugretention.health;

import com.example.bugretention.service.RetentionNotifier;
import com.example.bugretention.storage.StorageArchiver;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus the presence of optional collaborators. Missing collaborators are reported,
 * never fatal.
 */
@RestController
public class HealthController {

    private final ObjectProvider<BuildProperties> buildProperties;
    private final ObjectProvider<StorageArchiver> archiver;
    private final ObjectProvider<RetentionNotifier> notifier;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            ObjectProvider<StorageArchiver> archiver,
                            ObjectProvider<RetentionNotifier> notifier,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.archiver = archiver;
        this.notifier = notifier;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        BuildProperties build = buildProperties.getIfAvailable();
        StorageArchiver storage = archiver.getIfAvailable();
        RetentionNotifier notifications = notifier.getIfAvailable();

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("storageArchiver", storage != null ? storage.strategyName() : "absent");
        components.put("notifier", notifications != null ? notifications.getClass().getSimpleName() : "absent");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ts", clock.instant().toString());
        body.put("env", env);
        body.put("app", build != null ? build.getName() : "bug-retention");
        body.put("version", build != null ? build.getVersion() : "dev");
        body.put("components", components);
        return ResponseEntity.ok(body);
    }
}
