package com.storeshots.service.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param forcedDevice catalog id or name applied to every file; {@code null} to resolve per file
 */
public record BatchRequest(
        Path inputRoot,
        Path outputRoot,
        boolean dryRun,
        PromotionMode mode,
        String forcedDevice) {

    public BatchRequest {
        Objects.requireNonNull(inputRoot, "inputRoot");
        Objects.requireNonNull(outputRoot, "outputRoot");
        Objects.requireNonNull(mode, "mode");
        forcedDevice = forcedDevice == null || forcedDevice.isBlank() ? null : forcedDevice.trim();
    }
}
