package com.storeshots.service.batch;

import java.nio.file.Path;
import java.util.List;

public record LocaleBatch(String locale, Path directory, List<Path> files) {

    public LocaleBatch {
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
