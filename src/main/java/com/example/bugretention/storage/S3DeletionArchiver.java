package com.example.bugretention.storage;

import com.example.bugretention.config.S3Config.S3Properties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Archive strategy that frees storage immediately by deleting the report's objects.
 */
@Component
@ConditionalOnProperty(value = "retention.archive.strategy", havingValue = "deletion", matchIfMissing = true)
public class S3DeletionArchiver implements StorageArchiver {

    private final S3ObjectRemover remover;

    public S3DeletionArchiver(S3Client s3, S3Properties s3Properties) {
        this.remover = new S3ObjectRemover(s3, s3Properties.bucketName());
    }

    @Override
    public ArchiveResult archiveReportFiles(String screenshotUrl, String replayUrl) {
        return remover.deleteAll(screenshotUrl, replayUrl);
    }

    @Override
    public ArchiveResult deleteReportFiles(String screenshotUrl, String replayUrl) {
        return remover.deleteAll(screenshotUrl, replayUrl);
    }

    @Override
    public String strategyName() {
        return "deletion";
    }
}
