package com.storeshots.service.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolved, flat description of one output target. Catalog records are converted into this
 * shape by {@link DeviceSpecAdapter}; the compositing code only ever sees this type.
 *
 * <p>The screenshot fields describe the screen cutout of a bezel and are zero for devices
 * that are not {@link DeviceKind#FRAME_OVERLAY}. {@code frameAsset} is {@code null} unless
 * the device is a frame overlay and {@code scalePolicy} is only meaningful for
 * {@link DeviceKind#GRADIENT_CANVAS}.
 */
public record DeviceSpec(
        String id,
        String name,
        DeviceKind kind,
        int canvasWidth,
        int canvasHeight,
        int screenshotX,
        int screenshotY,
        int screenshotWidth,
        int screenshotHeight,
        Path frameAsset,
        double scalePolicy,
        int cornerRadius,
        Pattern filenamePattern,
        List<Dimensions> rawDimensions) {

    public DeviceSpec {
        rawDimensions = rawDimensions == null ? List.of() : List.copyOf(rawDimensions);
    }

    public Dimensions canvas() {
        return new Dimensions(canvasWidth, canvasHeight);
    }

    public Dimensions screenArea() {
        return new Dimensions(screenshotWidth, screenshotHeight);
    }

    public boolean hasFrame() {
        return frameAsset != null;
    }

    public boolean matchesFilename(String filename) {
        return filenamePattern != null && filename != null && filenamePattern.matcher(filename).find();
    }

    public boolean recognizes(int width, int height) {
        return rawDimensions.stream().anyMatch(dimensions -> dimensions.matches(width, height));
    }
}
