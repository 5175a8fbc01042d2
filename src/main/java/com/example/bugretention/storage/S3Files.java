package com.example.bugretention.storage;

import java.util.ArrayList;
import java.util.List;

final class S3Files {

    private S3Files() {
    }

    static List<String> present(String... urls) {
        List<String> result = new ArrayList<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                result.add(url);
            }
        }
        return result;
    }
}
