package com.storeshots.service.catalog;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum DeviceKind {
    FRAME_OVERLAY("frame-overlay"),
    GRADIENT_CANVAS("gradient-canvas"),
    NORMALIZE("normalize");

    private final String catalogName;

    DeviceKind(String catalogName) {
        this.catalogName = catalogName;
    }

    public String catalogName() {
        return catalogName;
    }

    public static Optional<DeviceKind> fromCatalogName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(kind -> kind.catalogName.equals(normalized))
                .findFirst();
    }
}
