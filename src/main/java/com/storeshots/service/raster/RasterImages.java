package com.storeshots.service.raster;

import com.storeshots.exception.CompositionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

/**
 * Mat plumbing shared by the composers. All images handed out are 8-bit BGR unless a method
 * says otherwise; masks are single channel 8-bit with 255 meaning fully opaque. Returned Mats
 * are owned by the caller, which frees them with {@link #release(Mat...)}.
 */
public final class RasterImages {

    private static final int PNG_COMPRESSION = 9;
    private static final int JPEG_QUALITY = 95;

    private RasterImages() {
    }

    /**
     * Decodes a file keeping every channel the file declares.
     */
    public static Mat read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        Mat encoded = new Mat(bytes);
        Mat decoded;
        try {
            decoded = opencv_imgcodecs.imdecode(encoded, opencv_imgcodecs.IMREAD_UNCHANGED);
        } finally {
            encoded.close();
        }
        if (decoded == null || decoded.empty()) {
            release(decoded);
            throw new CompositionException("Unable to decode " + path.getFileName());
        }
        return decoded;
    }

    /**
     * Frees the native memory behind each Mat. Null entries are ignored.
     */
    public static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null && !mat.isNull()) {
                mat.close();
            }
        }
    }

    /**
     * Encodes with the codec implied by the file extension and writes the bytes. No metadata
     * chunks are emitted.
     */
    public static void write(Mat image, Path target) throws IOException {
        String extension = extension(target);
        IntPointer params = extension.equals(".png")
                ? new IntPointer(opencv_imgcodecs.IMWRITE_PNG_COMPRESSION, PNG_COMPRESSION)
                : new IntPointer(opencv_imgcodecs.IMWRITE_JPEG_QUALITY, JPEG_QUALITY);
        byte[] bytes;
        try (BytePointer buffer = new BytePointer()) {
            if (!opencv_imgcodecs.imencode(extension, image, buffer, params)) {
                throw new CompositionException("Failed to encode " + target.getFileName() + " as " + extension);
            }
            bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
        } finally {
            params.close();
        }
        Files.write(target, bytes);
    }

    /**
     * Converts any decoded screenshot to 8-bit BGR. Transparent pixels are composited over
     * {@code background} rather than dropped.
     */
    public static Mat flatten(Mat source, Scalar background) {
        Mat eightBit = source;
        if (source.depth() == opencv_core.CV_16U) {
            eightBit = new Mat();
            source.convertTo(eightBit, opencv_core.CV_8U, 1.0 / 257.0, 0);
        }
        try {
            if (eightBit.channels() == 1) {
                Mat color = new Mat();
                opencv_imgproc.cvtColor(eightBit, color, opencv_imgproc.COLOR_GRAY2BGR);
                return color;
            }
            if (eightBit.channels() == 3) {
                return eightBit.clone();
            }
            if (eightBit.channels() == 4) {
                return flattenAlpha(eightBit, background);
            }
            throw new CompositionException("Unsupported channel count " + eightBit.channels());
        } finally {
            if (eightBit != source) {
                eightBit.close();
            }
        }
    }

    /**
     * Decodes a file straight to 8-bit BGR, see {@link #flatten(Mat, Scalar)}.
     */
    public static Mat readFlat(Path path, Scalar background) throws IOException {
        Mat decoded = read(path);
        try {
            return flatten(decoded, background);
        } finally {
            decoded.close();
        }
    }

    public static Mat solid(int width, int height, Scalar color) {
        return new Mat(height, width, opencv_core.CV_8UC3, color);
    }

    /**
     * Resamples to the exact size, choosing area interpolation when shrinking.
     */
    public static Mat resize(Mat source, int width, int height) {
        if (source.cols() == width && source.rows() == height) {
            return source.clone();
        }
        boolean shrinking = width < source.cols() || height < source.rows();
        Mat resized = new Mat();
        opencv_imgproc.resize(source, resized, new Size(width, height), 0, 0,
                shrinking ? opencv_imgproc.INTER_AREA : opencv_imgproc.INTER_CUBIC);
        return resized;
    }

    public static Mat crop(Mat source, int x, int y, int width, int height) {
        Mat roi = new Mat(source, new Rect(x, y, width, height));
        try {
            return roi.clone();
        } finally {
            roi.close();
        }
    }

    /**
     * Mask of a rectangle with circular corners. A radius of zero yields a fully opaque mask.
     */
    public static Mat roundedMask(int width, int height, int radius) {
        Mat mask = new Mat(height, width, opencv_core.CV_8UC1, new Scalar(0.0));
        int r = Math.max(0, Math.min(radius, Math.min(width, height) / 2));
        Scalar opaque = new Scalar(255.0);
        if (r == 0) {
            mask.put(opaque);
            return mask;
        }
        if (width - 2 * r > 0) {
            opencv_imgproc.rectangle(mask, new Rect(r, 0, width - 2 * r, height), opaque,
                    opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
        }
        if (height - 2 * r > 0) {
            opencv_imgproc.rectangle(mask, new Rect(0, r, width, height - 2 * r), opaque,
                    opencv_imgproc.FILLED, opencv_imgproc.LINE_8, 0);
        }
        int right = width - 1 - r;
        int bottom = height - 1 - r;
        for (Point center : new Point[] {new Point(r, r), new Point(right, r), new Point(r, bottom),
                new Point(right, bottom)}) {
            opencv_imgproc.circle(mask, center, r, opaque, opencv_imgproc.FILLED, opencv_imgproc.LINE_AA, 0);
        }
        return mask;
    }

    /**
     * Alpha-blends {@code layer} into the region {@code at} of {@code canvas} in place. The layer
     * and the mask must have the size of the region and the region must lie inside the canvas.
     */
    public static void blendInto(Mat canvas, Mat layer, Mat mask, Rect at) {
        Mat region = new Mat(canvas, at);
        Mat alpha = new Mat();
        Mat alpha3 = new Mat();
        Mat inverseMask = new Mat();
        Mat inverse = new Mat();
        Mat inverse3 = new Mat();
        Mat foreground = new Mat();
        Mat background = new Mat();
        Mat weightedForeground = new Mat();
        Mat weightedBackground = new Mat();
        Mat sum = new Mat();
        Mat blended = new Mat();
        try {
            mask.convertTo(alpha, opencv_core.CV_32F, 1.0 / 255.0, 0);
            opencv_imgproc.cvtColor(alpha, alpha3, opencv_imgproc.COLOR_GRAY2BGR);

            opencv_core.bitwise_not(mask, inverseMask);
            inverseMask.convertTo(inverse, opencv_core.CV_32F, 1.0 / 255.0, 0);
            opencv_imgproc.cvtColor(inverse, inverse3, opencv_imgproc.COLOR_GRAY2BGR);

            layer.convertTo(foreground, opencv_core.CV_32FC3);
            region.convertTo(background, opencv_core.CV_32FC3);

            opencv_core.multiply(foreground, alpha3, weightedForeground);
            opencv_core.multiply(background, inverse3, weightedBackground);
            opencv_core.add(weightedForeground, weightedBackground, sum);

            sum.convertTo(blended, opencv_core.CV_8UC3);
            blended.copyTo(region);
        } finally {
            release(blended, sum, weightedBackground, weightedForeground, background, foreground, inverse3, inverse,
                    inverseMask, alpha3, alpha, region);
        }
    }

    /**
     * Parses {@code #RRGGBB} into an OpenCV BGR scalar.
     */
    public static Scalar color(String hex) {
        int[] rgb = rgb(hex);
        return new Scalar(rgb[2], rgb[1], rgb[0], 255);
    }

    /**
     * Relative luminance of a {@code #RRGGBB} color in {@code [0, 1]}.
     */
    public static double luminance(String hex) {
        int[] rgb = rgb(hex);
        return (0.299 * rgb[0] + 0.587 * rgb[1] + 0.114 * rgb[2]) / 255.0;
    }

    private static int[] rgb(String hex) {
        String value = hex == null ? "" : hex.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (value.length() != 6) {
            throw new IllegalArgumentException("Expected a #RRGGBB color but got '" + hex + "'");
        }
        try {
            int packed = Integer.parseInt(value, 16);
            return new int[] {(packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF};
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected a #RRGGBB color but got '" + hex + "'", ex);
        }
    }

    private static Mat flattenAlpha(Mat bgra, Scalar background) {
        MatVector channels = new MatVector();
        Mat color = new Mat();
        Mat alpha = null;
        try {
            opencv_core.split(bgra, channels);
            alpha = channels.get(3);
            opencv_imgproc.cvtColor(bgra, color, opencv_imgproc.COLOR_BGRA2BGR);
            Mat flat = new Mat(bgra.rows(), bgra.cols(), opencv_core.CV_8UC3, background);
            blendInto(flat, color, alpha, new Rect(0, 0, flat.cols(), flat.rows()));
            return flat;
        } finally {
            release(alpha, color);
            channels.close();
        }
    }

    private static String extension(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
        return extension.equals(".jpeg") ? ".jpg" : extension;
    }
}
