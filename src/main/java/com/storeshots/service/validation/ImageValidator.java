package com.storeshots.service.validation;

import com.storeshots.config.StoreShotsProperties.ValidationProperties;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.ValidationException;
import com.storeshots.service.catalog.Dimensions;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks on screenshots before and after composition. Nothing here trusts the
 * component that wrote a file: every verdict is derived from the bytes on disk.
 */
public class ImageValidator {

    private static final Logger log = LoggerFactory.getLogger(ImageValidator.class);

    private static final Map<String, String> FORMAT_BY_EXTENSION = Map.of(
            "png", "png",
            "jpg", "jpeg",
            "jpeg", "jpeg");

    private static final int LUMINANCE_SAMPLES = 100_000;

    private final ValidationProperties limits;

    public ImageValidator(ValidationProperties limits) {
        this.limits = limits;
    }

    /**
     * Reads format and dimensions from the image header without decoding pixel data.
     */
    public ImageInspection inspectHeader(Path path) {
        return measure(path, ErrorKind.INPUT_INVALID, false).inspection();
    }

    /**
     * Full input check: the file exists, is non-empty, its content format matches its
     * extension and it decodes completely.
     */
    public ImageInspection validateInput(Path path) {
        ImageInspection inspection = measure(path, ErrorKind.INPUT_INVALID, true).inspection();
        log.debug("Input {} is a valid {} {}x{}", path.getFileName(), inspection.format(),
                inspection.width(), inspection.height());
        return inspection;
    }

    public OutputReport validateOutput(Path path, Dimensions expected) {
        Measured measured = measure(path, ErrorKind.OUTPUT_INVALID, true);
        ImageInspection inspection = measured.inspection();

        List<String> violations = new ArrayList<>();
        if (!expected.matches(inspection.width(), inspection.height())) {
            violations.add("dimensions " + inspection.dimensions() + " do not match expected " + expected);
        }
        if (inspection.hasAlpha()) {
            violations.add("output carries an alpha channel");
        }
        if (inspection.sizeBytes() > limits.maxOutputBytes()) {
            violations.add("size " + inspection.sizeBytes() + " bytes exceeds ceiling of " + limits.maxOutputBytes());
        }
        if (inspection.sizeBytes() < limits.minOutputBytes()) {
            violations.add("size " + inspection.sizeBytes() + " bytes is below floor of " + limits.minOutputBytes());
        }
        if (!violations.isEmpty()) {
            throw ValidationException.output(path.getFileName() + ": " + String.join("; ", violations));
        }

        double luminance = meanLuminance(measured.image());
        List<String> warnings = new ArrayList<>();
        if (luminance < limits.blankDarkThreshold()) {
            warnings.add(String.format(Locale.ROOT, "possibly blank (black), mean luminance %.3f", luminance));
        } else if (luminance > limits.blankLightThreshold()) {
            warnings.add(String.format(Locale.ROOT, "possibly blank (white), mean luminance %.3f", luminance));
        }
        return new OutputReport(inspection, luminance, warnings);
    }

    private Measured measure(Path path, ErrorKind kind, boolean decode) {
        if (path == null || !Files.exists(path)) {
            throw new ValidationException(kind, "File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new ValidationException(kind, "Not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new ValidationException(kind, "File is not readable: " + path);
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException ex) {
            throw new ValidationException(kind, "Unable to read size of " + path, ex);
        }
        if (size == 0) {
            throw new ValidationException(kind, "File is empty: " + path);
        }

        try (ImageInputStream stream = ImageIO.createImageInputStream(path.toFile())) {
            if (stream == null) {
                throw new ValidationException(kind, "Unable to open image stream for " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                throw new ValidationException(kind, "Not a decodable raster image: " + path);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true, true);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                checkFormatMatchesExtension(path, format, kind);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new ValidationException(kind, "Invalid dimensions " + width + "x" + height + " in " + path);
                }
                BufferedImage image = decode ? reader.read(0) : null;
                boolean alpha = image != null ? image.getColorModel().hasAlpha() : declaresAlpha(reader);
                return new Measured(new ImageInspection(path, format, width, height, alpha, size), image);
            } finally {
                reader.dispose();
            }
        } catch (IOException ex) {
            throw new ValidationException(kind, "Corrupt or truncated image " + path + ": " + ex.getMessage(), ex);
        } catch (ValidationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ValidationException(kind, "Decoder rejected " + path + ": " + ex, ex);
        }
    }

    private static void checkFormatMatchesExtension(Path path, String format, ErrorKind kind) {
        String filename = path.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        String expected = FORMAT_BY_EXTENSION.getOrDefault(extension, extension);
        if (!expected.equals(format)) {
            throw new ValidationException(kind, "Content of " + filename + " is " + format
                    + " but its extension declares " + (extension.isEmpty() ? "nothing" : extension));
        }
    }

    private static boolean declaresAlpha(ImageReader reader) throws IOException {
        ImageTypeSpecifier raw = reader.getRawImageType(0);
        return raw != null && raw.getColorModel().hasAlpha();
    }

    static double meanLuminance(BufferedImage image) {
        if (image == null) {
            return 0.0;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int step = Math.max(1, (int) Math.sqrt((double) width * height / LUMINANCE_SAMPLES));
        double total = 0.0;
        long samples = 0;
        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                total += (0.299 * r + 0.587 * g + 0.114 * b) / 255.0;
                samples++;
            }
        }
        return samples == 0 ? 0.0 : total / samples;
    }

    private record Measured(ImageInspection inspection, BufferedImage image) {
    }
}
