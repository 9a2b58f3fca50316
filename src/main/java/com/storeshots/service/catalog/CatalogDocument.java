package com.storeshots.service.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * On-disk shapes of the device catalog. Version 2 nests geometry for readability; version 1
 * is the older flat layout that is still accepted.
 */
public final class CatalogDocument {

    public static final int LEGACY_VERSION = 1;
    public static final int CURRENT_VERSION = 2;

    private CatalogDocument() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeviceRecord(
            String id,
            String name,
            String kind,
            Size canvas,
            Area screenArea,
            FrameRecord frame,
            Double scale,
            Integer cornerRadius,
            String filenamePattern,
            List<Size> rawDimensions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Size(Integer width, Integer height) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Area(Integer x, Integer y, Integer width, Integer height) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FrameRecord(String directory, Map<String, String> variants, String defaultVariant) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LegacyDeviceRecord(
            String id,
            String name,
            String kind,
            Integer canvasWidth,
            Integer canvasHeight,
            Integer screenX,
            Integer screenY,
            Integer screenWidth,
            Integer screenHeight,
            String frame,
            Double scale,
            Integer cornerRadius,
            String filenamePattern,
            List<String> rawSizes) {
    }
}
