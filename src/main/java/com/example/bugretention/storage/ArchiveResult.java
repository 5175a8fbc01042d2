package com.example.bugretention.storage;

import java.util.ArrayList;
import java.util.List;

public record ArchiveResult(int filesArchived, long bytesArchived, List<FileError> errors) {

    public ArchiveResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ArchiveResult empty() {
        return new ArchiveResult(0, 0L, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public ArchiveResult plus(ArchiveResult other) {
        List<FileError> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ArchiveResult(filesArchived + other.filesArchived, bytesArchived + other.bytesArchived, merged);
    }

    public record FileError(String key, String error) { }
}
