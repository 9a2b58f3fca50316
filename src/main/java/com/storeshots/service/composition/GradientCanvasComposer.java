package com.storeshots.service.composition;

import com.storeshots.config.StoreShotsProperties.CornerProperties;
import com.storeshots.config.StoreShotsProperties.GradientProperties;
import com.storeshots.config.StoreShotsProperties.ShadowProperties;
import com.storeshots.service.catalog.DeviceKind;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.catalog.Dimensions;
import com.storeshots.service.raster.RasterImages;
import com.storeshots.service.validation.ImageInspection;
import java.io.IOException;
import java.nio.file.Path;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centers a window screenshot on a fixed marketing canvas painted with a radial gradient,
 * with rounded corners and a soft drop shadow underneath.
 */
public class GradientCanvasComposer implements Composer {

    private static final Logger log = LoggerFactory.getLogger(GradientCanvasComposer.class);

    private final Scalar center;
    private final Scalar edge;
    private final ShadowProperties shadow;
    private final CornerProperties corners;

    public GradientCanvasComposer(GradientProperties properties) {
        this.center = RasterImages.color(properties.centerColor());
        this.edge = RasterImages.color(properties.edgeColor());
        this.shadow = properties.shadow();
        this.corners = properties.corners();
        if (RasterImages.luminance(properties.centerColor()) < RasterImages.luminance(properties.edgeColor())) {
            log.warn("Gradient center {} is darker than edge {}; the canvas will look inverted",
                    properties.centerColor(), properties.edgeColor());
        }
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.GRADIENT_CANVAS;
    }

    @Override
    public void compose(ImageInspection source, DeviceSpec device, Path target) throws IOException {
        Dimensions canvasSize = device.canvas();
        CanvasPlacement placement = CanvasPlacement.centered(source.dimensions(), canvasSize, device.scalePolicy());
        log.debug("Placing {} {} at {},{} scaled {} on {}", source.path().getFileName(), source.dimensions(),
                placement.x(), placement.y(), placement.size(), canvasSize);

        Mat screenshot = RasterImages.readFlat(source.path(), center);
        Mat scaled = null;
        Mat mask = null;
        Mat canvas = null;
        try {
            scaled = RasterImages.resize(screenshot, placement.width(), placement.height());
            mask = RasterImages.roundedMask(placement.width(), placement.height(), cornerRadius(device, placement));
            canvas = radialGradient(canvasSize.width(), canvasSize.height());
            castShadow(canvas, mask, placement);
            RasterImages.blendInto(canvas, scaled, mask,
                    new Rect(placement.x(), placement.y(), placement.width(), placement.height()));
            RasterImages.write(canvas, target);
        } finally {
            RasterImages.release(canvas, mask, scaled, screenshot);
        }
    }

    int cornerRadius(DeviceSpec device, CanvasPlacement placement) {
        if (!corners.enabled()) {
            return 0;
        }
        if (device.cornerRadius() > 0) {
            return device.cornerRadius();
        }
        int proportional = (int) Math.round(corners.baseRadius() * placement.width() / (double) corners.referenceWidth());
        return Math.max(corners.minimumRadius(), proportional);
    }

    Mat radialGradient(int width, int height) {
        Mat canvas = new Mat(height, width, opencv_core.CV_8UC3);
        double centerX = (width - 1) / 2.0;
        double centerY = (height - 1) / 2.0;
        double radius = Math.hypot(width / 2.0, height / 2.0);
        double[] from = {center.get(0), center.get(1), center.get(2)};
        double[] to = {edge.get(0), edge.get(1), edge.get(2)};
        UByteIndexer indexer = canvas.createIndexer();
        try {
            for (int y = 0; y < height; y++) {
                double dy = y - centerY;
                for (int x = 0; x < width; x++) {
                    double t = Math.min(1.0, Math.hypot(x - centerX, dy) / radius);
                    for (int channel = 0; channel < 3; channel++) {
                        indexer.put(y, x, channel, (int) Math.round(from[channel] + (to[channel] - from[channel]) * t));
                    }
                }
            }
        } finally {
            indexer.release();
        }
        return canvas;
    }

    private void castShadow(Mat canvas, Mat mask, CanvasPlacement placement) {
        if (shadow.opacity() <= 0.0) {
            return;
        }
        int pad = (int) Math.ceil(Math.max(0.0, shadow.blurRadius()) * 3);
        int shadowY = placement.y() + shadow.offsetY();
        int left = Math.max(0, placement.x() - pad);
        int top = Math.max(0, shadowY - pad);
        int right = Math.min(canvas.cols(), placement.x() + placement.width() + pad);
        int bottom = Math.min(canvas.rows(), shadowY + placement.height() + pad);
        if (right <= left || bottom <= top) {
            return;
        }

        int offsetX = placement.x() - left;
        int offsetY = shadowY - top;
        int sourceTop = Math.max(0, -offsetY);
        int targetTop = Math.max(0, offsetY);
        int rows = Math.min(mask.rows() - sourceTop, bottom - top - targetTop);
        int cols = Math.min(mask.cols(), right - left - offsetX);
        if (rows <= 0 || cols <= 0) {
            return;
        }

        // The blurred mask only needs the area the blur can reach.
        Mat shadowMask = new Mat(bottom - top, right - left, opencv_core.CV_8UC1, new Scalar(0.0));
        Mat visible = null;
        Mat slot = null;
        Mat blurred = null;
        Mat alpha = new Mat();
        Mat black = null;
        try {
            visible = RasterImages.crop(mask, 0, sourceTop, cols, rows);
            slot = new Mat(shadowMask, new Rect(offsetX, targetTop, cols, rows));
            visible.copyTo(slot);

            if (shadow.blurRadius() > 0.0) {
                blurred = new Mat();
                opencv_imgproc.GaussianBlur(shadowMask, blurred, new Size(0, 0), shadow.blurRadius());
            }
            Mat spread = blurred == null ? shadowMask : blurred;
            spread.convertTo(alpha, opencv_core.CV_8U, Math.min(1.0, shadow.opacity()), 0);
            black = RasterImages.solid(alpha.cols(), alpha.rows(), new Scalar(0, 0, 0, 255));
            RasterImages.blendInto(canvas, black, alpha, new Rect(left, top, alpha.cols(), alpha.rows()));
        } finally {
            RasterImages.release(black, alpha, blurred, slot, visible, shadowMask);
        }
    }
}
