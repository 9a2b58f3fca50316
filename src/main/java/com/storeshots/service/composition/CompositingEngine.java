package com.storeshots.service.composition;

import com.storeshots.exception.CompositionException;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.ScreenshotProcessingException;
import com.storeshots.service.catalog.DeviceKind;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.raster.RasterInvoker;
import com.storeshots.service.validation.ImageInspection;
import com.storeshots.service.validation.ImageValidator;
import com.storeshots.service.validation.OutputReport;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one screenshot into one store asset. Composers write to a hidden part file next to
 * the requested output; the part file is re-measured and only renamed to its final name once
 * it passes output validation.
 */
public class CompositingEngine {

    private static final Logger log = LoggerFactory.getLogger(CompositingEngine.class);

    static final String PART_PREFIX = ".part-";

    private final ImageValidator validator;
    private final RasterInvoker invoker;
    private final Map<DeviceKind, Composer> composers = new EnumMap<>(DeviceKind.class);

    public CompositingEngine(ImageValidator validator, RasterInvoker invoker, List<Composer> composers) {
        this.validator = validator;
        this.invoker = invoker;
        for (Composer composer : composers) {
            if (this.composers.putIfAbsent(composer.kind(), composer) != null) {
                throw new IllegalStateException("More than one composer registered for " + composer.kind());
            }
        }
    }

    public CompositionOutcome compose(Path input, Path output, DeviceSpec device) {
        ImageInspection source = validator.validateInput(input);
        Composer composer = composers.get(device.kind());
        if (composer == null) {
            throw new CompositionException("No composer available for " + device.kind());
        }

        Path part = output.resolveSibling(PART_PREFIX + output.getFileName());
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            invoker.invoke(device.kind() + " " + input.getFileName(), () -> {
                composer.compose(source, device, part);
                return null;
            });
            if (!Files.isRegularFile(part) || Files.size(part) == 0) {
                throw new CompositionException("Composition of " + input.getFileName() + " produced no output");
            }
            OutputReport report = validator.validateOutput(part, device.canvas());
            report.warnings().forEach(warning -> log.warn("{}: {}", output.getFileName(), warning));
            moveIntoPlace(part, output);
            log.debug("Composed {} -> {} ({} on {})", input.getFileName(), output,
                    source.dimensions(), device.id());
            return new CompositionOutcome(device.id(), output, source.dimensions(),
                    report.inspection().dimensions(), report.inspection().sizeBytes(), report.warnings());
        } catch (IOException ex) {
            throw new ScreenshotProcessingException(ErrorKind.IO_FAILURE,
                    "I/O failure writing " + output.getFileName() + ": " + ex.getMessage(), ex);
        } finally {
            discard(part);
        }
    }

    private static void moveIntoPlace(Path part, Path output) throws IOException {
        try {
            Files.move(part, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(part, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException ex) {
            log.warn("Unable to remove part file {}: {}", part, ex.getMessage());
        }
    }
}
