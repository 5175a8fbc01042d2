package com.example.bugretention.storage;

import java.net.URI;
import java.net.URISyntaxException;

final class StorageKeys {

    private StorageKeys() {
    }

    /**
     * Object key for a stored file reference. Full URLs yield their path without the leading
     * slash (and without the bucket segment for path-style URLs); anything else is already a key.
     */
    static String extractKey(String urlOrKey, String bucket) {
        try {
            URI uri = new URI(urlOrKey);
            if (uri.getScheme() == null || uri.getPath() == null) {
                return urlOrKey;
            }
            String path = uri.getPath().startsWith("/") ? uri.getPath().substring(1) : uri.getPath();
            String bucketPrefix = bucket + "/";
            return path.startsWith(bucketPrefix) ? path.substring(bucketPrefix.length()) : path;
        } catch (URISyntaxException ex) {
            return urlOrKey;
        }
    }
}
