package com.example.bugretention.storage;

import com.example.bugretention.config.S3Config.S3Properties;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.StorageClass;

/**
 * Archive strategy that preserves files: each object is copied into the archive bucket under
 * {@code archive-prefix} with an infrequent-access storage class, then removed from the primary
 * bucket. The original is only deleted after the copy succeeded.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "retention.archive.strategy", havingValue = "copy")
public class S3CopyArchiver implements StorageArchiver {

    private final S3Client s3;
    private final String bucket;
    private final String archiveBucket;
    private final String archivePrefix;
    private final S3ObjectRemover remover;

    public S3CopyArchiver(S3Client s3, S3Properties s3Properties) {
        this.s3 = s3;
        this.remover = new S3ObjectRemover(s3, s3Properties.bucketName());
        this.bucket = s3Properties.bucketName();
        this.archiveBucket = s3Properties.archiveBucketName() != null && !s3Properties.archiveBucketName().isBlank()
                ? s3Properties.archiveBucketName()
                : s3Properties.bucketName();
        this.archivePrefix = s3Properties.archivePrefix() != null ? s3Properties.archivePrefix() : "archive/";
    }

    @Override
    public ArchiveResult archiveReportFiles(String screenshotUrl, String replayUrl) {
        int archived = 0;
        long bytes = 0;
        List<ArchiveResult.FileError> errors = new ArrayList<>();

        for (String url : S3Files.present(screenshotUrl, replayUrl)) {
            try {
                String key = StorageKeys.extractKey(url, bucket);
                HeadObjectResponse head = s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
                s3.copyObject(CopyObjectRequest.builder()
                        .sourceBucket(bucket)
                        .sourceKey(key)
                        .destinationBucket(archiveBucket)
                        .destinationKey(archivePrefix + key)
                        .storageClass(StorageClass.STANDARD_IA)
                        .build());
                s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
                archived++;
                bytes += head.contentLength() == null ? 0L : head.contentLength();
                log.debug("Archived storage object {} to {}/{}", key, archiveBucket, archivePrefix + key);
            } catch (RuntimeException ex) {
                errors.add(new ArchiveResult.FileError(url, ex.getMessage()));
                log.error("Error archiving storage file {}: {}", url, ex.getMessage());
            }
        }
        return new ArchiveResult(archived, bytes, errors);
    }

    /**
     * Removes the originals without keeping a copy; used when the policy does not ask for
     * archiving.
     */
    @Override
    public ArchiveResult deleteReportFiles(String screenshotUrl, String replayUrl) {
        return remover.deleteAll(screenshotUrl, replayUrl);
    }

    @Override
    public String strategyName() {
        return "copy";
    }
}
