package com.example.bugretention.storage;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Deletes report objects from the primary bucket, sizing each one first so the freed bytes can
 * be reported. A missing object counts as deleted with zero bytes.
 */
@Slf4j
final class S3ObjectRemover {

    private final S3Client s3;
    private final String bucket;

    S3ObjectRemover(S3Client s3, String bucket) {
        this.s3 = s3;
        this.bucket = bucket;
    }

    ArchiveResult deleteAll(String screenshotUrl, String replayUrl) {
        int deleted = 0;
        long bytes = 0;
        List<ArchiveResult.FileError> errors = new ArrayList<>();

        for (String url : S3Files.present(screenshotUrl, replayUrl)) {
            try {
                String key = StorageKeys.extractKey(url, bucket);
                long size = sizeOf(key);
                s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
                deleted++;
                bytes += size;
                log.debug("Deleted storage object {} ({} bytes)", key, size);
            } catch (RuntimeException ex) {
                errors.add(new ArchiveResult.FileError(url, ex.getMessage()));
                log.error("Error deleting storage file {}: {}", url, ex.getMessage());
            }
        }
        return new ArchiveResult(deleted, bytes, errors);
    }

    private long sizeOf(String key) {
        try {
            Long length = s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build())
                    .contentLength();
            return length == null ? 0L : length;
        } catch (NoSuchKeyException ex) {
            log.debug("Storage object {} not found while sizing", key);
            return 0L;
        }
    }
}
