package com.storeshots.service.composition;

import com.storeshots.service.catalog.Dimensions;
import java.nio.file.Path;
import java.util.List;

public record CompositionOutcome(
        String deviceId,
        Path output,
        Dimensions inputDimensions,
        Dimensions outputDimensions,
        long sizeBytes,
        List<String> warnings) {

    public CompositionOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
