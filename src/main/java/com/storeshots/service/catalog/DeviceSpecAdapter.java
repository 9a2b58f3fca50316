package com.storeshots.service.catalog;

import com.storeshots.exception.CatalogException;
import com.storeshots.service.catalog.CatalogDocument.Area;
import com.storeshots.service.catalog.CatalogDocument.DeviceRecord;
import com.storeshots.service.catalog.CatalogDocument.FrameRecord;
import com.storeshots.service.catalog.CatalogDocument.LegacyDeviceRecord;
import com.storeshots.service.catalog.CatalogDocument.Size;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts catalog records into the flat {@link DeviceSpec}. Legacy records are first upgraded
 * to the current nested shape so that there is a single conversion path to validate.
 */
public class DeviceSpecAdapter {

    private static final Logger log = LoggerFactory.getLogger(DeviceSpecAdapter.class);

    private static final String LEGACY_VARIANT = "default";

    private final Path framesDirectory;
    private final String preferredVariant;

    public DeviceSpecAdapter(Path framesDirectory, String preferredVariant) {
        this.framesDirectory = framesDirectory;
        this.preferredVariant = preferredVariant == null ? "" : preferredVariant.trim();
    }

    public DeviceRecord upgrade(LegacyDeviceRecord legacy) {
        Size canvas = legacy.canvasWidth() == null && legacy.canvasHeight() == null
                ? null
                : new Size(legacy.canvasWidth(), legacy.canvasHeight());
        Area screenArea = legacy.screenWidth() == null && legacy.screenHeight() == null
                ? null
                : new Area(legacy.screenX(), legacy.screenY(), legacy.screenWidth(), legacy.screenHeight());
        FrameRecord frame = legacy.frame() == null || legacy.frame().isBlank()
                ? null
                : new FrameRecord(null, Map.of(LEGACY_VARIANT, legacy.frame()), LEGACY_VARIANT);
        List<Size> raw = null;
        if (legacy.rawSizes() != null) {
            raw = new ArrayList<>();
            for (String size : legacy.rawSizes()) {
                try {
                    Dimensions parsed = Dimensions.parse(size);
                    raw.add(new Size(parsed.width(), parsed.height()));
                } catch (IllegalArgumentException ex) {
                    throw new CatalogException("Device '" + legacy.id() + "': " + ex.getMessage(), ex);
                }
            }
        }
        return new DeviceRecord(
                legacy.id(),
                legacy.name(),
                legacy.kind(),
                canvas,
                screenArea,
                frame,
                legacy.scale(),
                legacy.cornerRadius(),
                legacy.filenamePattern(),
                raw);
    }

    public DeviceSpec toSpec(DeviceRecord record) {
        String id = record.id();
        if (id == null || id.isBlank()) {
            throw new CatalogException("Catalog entry without an id");
        }
        DeviceKind kind = DeviceKind.fromCatalogName(record.kind())
                .orElseThrow(() -> invalid(id, "unknown kind '" + record.kind() + "'"));
        String name = record.name() == null || record.name().isBlank() ? id : record.name();

        Dimensions canvas = requireDimensions(id, "canvas", record.canvas());
        int cornerRadius = record.cornerRadius() == null ? 0 : record.cornerRadius();
        if (cornerRadius < 0) {
            throw invalid(id, "cornerRadius must not be negative");
        }
        Pattern filenamePattern = compile(id, record.filenamePattern());
        List<Dimensions> raw = rawDimensions(id, record.rawDimensions());

        if (kind == DeviceKind.FRAME_OVERLAY) {
            Area area = record.screenArea();
            if (area == null) {
                throw invalid(id, "frame-overlay devices require a screenArea");
            }
            if (area.x() == null || area.y() == null || area.width() == null || area.height() == null) {
                throw invalid(id, "screenArea requires x, y, width and height");
            }
            if (area.width() <= 0 || area.height() <= 0) {
                throw invalid(id, "screenArea must have positive dimensions");
            }
            if (area.x() < 0 || area.y() < 0) {
                throw invalid(id, "screenArea offsets must not be negative");
            }
            if (area.width() > canvas.width() - area.x() || area.height() > canvas.height() - area.y()) {
                throw invalid(id, "screenArea " + area.width() + "x" + area.height() + "+" + area.x() + "+"
                        + area.y() + " is not contained in canvas " + canvas);
            }
            Path frameAsset = resolveFrame(id, record.frame());
            if (raw.isEmpty()) {
                raw = List.of(new Dimensions(area.width(), area.height()));
            }
            return new DeviceSpec(id, name, kind, canvas.width(), canvas.height(),
                    area.x(), area.y(), area.width(), area.height(),
                    frameAsset, 1.0, cornerRadius, filenamePattern, raw);
        }
        if (kind == DeviceKind.GRADIENT_CANVAS) {
            double scale = record.scale() == null ? 1.0 : record.scale();
            if (!(scale > 0.0 && scale <= 1.0)) {
                throw invalid(id, "scale must be within (0, 1] but was " + scale);
            }
            return new DeviceSpec(id, name, kind, canvas.width(), canvas.height(),
                    0, 0, 0, 0, null, scale, cornerRadius, filenamePattern, raw);
        }
        return new DeviceSpec(id, name, kind, canvas.width(), canvas.height(),
                0, 0, 0, 0, null, 1.0, cornerRadius, filenamePattern, raw);
    }

    private Path resolveFrame(String id, FrameRecord frame) {
        if (frame == null || frame.variants() == null || frame.variants().isEmpty()) {
            throw invalid(id, "frame-overlay devices require at least one frame variant");
        }
        String variant = frame.defaultVariant();
        if (!preferredVariant.isEmpty()) {
            if (frame.variants().containsKey(preferredVariant)) {
                variant = preferredVariant;
            } else {
                log.warn("Device {} has no '{}' frame variant; using '{}'", id, preferredVariant, variant);
            }
        }
        if (variant == null || !frame.variants().containsKey(variant)) {
            variant = frame.variants().keySet().stream().sorted().findFirst().orElseThrow();
        }
        String file = frame.variants().get(variant);
        if (file == null || file.isBlank()) {
            throw invalid(id, "frame variant '" + variant + "' has no file");
        }
        Path base = frame.directory() == null || frame.directory().isBlank()
                ? framesDirectory
                : framesDirectory.resolve(frame.directory());
        return base.resolve(file).normalize();
    }

    private static Dimensions requireDimensions(String id, String field, Size size) {
        if (size == null || size.width() == null || size.height() == null) {
            throw invalid(id, field + " requires width and height");
        }
        Dimensions dimensions = new Dimensions(size.width(), size.height());
        if (!dimensions.isPositive()) {
            throw invalid(id, field + " must have positive dimensions but was " + dimensions);
        }
        return dimensions;
    }

    private static List<Dimensions> rawDimensions(String id, List<Size> sizes) {
        if (sizes == null) {
            return List.of();
        }
        List<Dimensions> result = new ArrayList<>(sizes.size());
        for (Size size : sizes) {
            result.add(requireDimensions(id, "rawDimensions", size));
        }
        return result;
    }

    private static Pattern compile(String id, String regex) {
        if (regex == null || regex.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new CatalogException("Device '" + id + "': invalid filenamePattern " + regex, ex);
        }
    }

    private static CatalogException invalid(String id, String message) {
        return new CatalogException("Device '" + id + "': " + message);
    }
}
