package com.storeshots.service.validation;

import com.storeshots.service.catalog.Dimensions;
import java.nio.file.Path;

/**
 * Facts measured from the bytes of an image file.
 */
public record ImageInspection(Path path, String format, int width, int height, boolean hasAlpha, long sizeBytes) {

    public Dimensions dimensions() {
        return new Dimensions(width, height);
    }
}
