package com.storeshots.service.composition;

import com.storeshots.config.StoreShotsProperties.FrameProperties;
import com.storeshots.exception.CompositionException;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.GeometryException;
import com.storeshots.exception.ValidationException;
import com.storeshots.service.catalog.DeviceKind;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.catalog.Dimensions;
import com.storeshots.service.raster.RasterImages;
import com.storeshots.service.validation.ImageInspection;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places a screenshot into the screen cutout of a device bezel. The screenshot must already
 * have the exact cutout size; nothing here resizes it.
 */
public class FrameOverlayComposer implements Composer {

    private static final Logger log = LoggerFactory.getLogger(FrameOverlayComposer.class);

    private final Scalar background;
    private final Scalar screenFill;
    private final int screenFillPadding;

    public FrameOverlayComposer(FrameProperties properties) {
        this.background = RasterImages.color(properties.backgroundColor());
        this.screenFill = RasterImages.color(properties.screenFillColor());
        this.screenFillPadding = Math.max(0, properties.screenFillPadding());
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.FRAME_OVERLAY;
    }

    @Override
    public void compose(ImageInspection source, DeviceSpec device, Path target) throws IOException {
        Dimensions screen = device.screenArea();
        if (!screen.equals(source.dimensions())) {
            throw ValidationException.input(source.path().getFileName() + " is " + source.dimensions()
                    + " but " + device.id() + " expects exactly " + screen);
        }
        Mat frame = loadFrame(device);
        Mat canvas = null;
        Mat screenshot = null;
        Mat screenSlot = null;
        MatVector channels = new MatVector();
        Mat frameAlpha = null;
        Mat bezel = new Mat();
        try {
            canvas = RasterImages.solid(device.canvasWidth(), device.canvasHeight(), background);
            fillBehindScreen(canvas, device);

            screenshot = RasterImages.readFlat(source.path(), screenFill);
            screenSlot = new Mat(canvas, new Rect(device.screenshotX(), device.screenshotY(),
                    screen.width(), screen.height()));
            screenshot.copyTo(screenSlot);

            opencv_core.split(frame, channels);
            frameAlpha = channels.get(3);
            opencv_imgproc.cvtColor(frame, bezel, opencv_imgproc.COLOR_BGRA2BGR);
            RasterImages.blendInto(canvas, bezel, frameAlpha, new Rect(0, 0, canvas.cols(), canvas.rows()));

            log.debug("Framed {} with {}", source.path().getFileName(), device.frameAsset().getFileName());
            RasterImages.write(canvas, target);
        } finally {
            RasterImages.release(bezel, frameAlpha, screenSlot, screenshot, canvas, frame);
            channels.close();
        }
    }

    private Mat loadFrame(DeviceSpec device) throws IOException {
        Path asset = device.frameAsset();
        if (asset == null || !Files.isRegularFile(asset)) {
            throw new CompositionException(ErrorKind.FRAME_ASSET_MISSING,
                    "Frame asset for " + device.id() + " not found: " + asset);
        }
        Mat frame = RasterImages.read(asset);
        if (frame.cols() != device.canvasWidth() || frame.rows() != device.canvasHeight()) {
            String actual = frame.cols() + "x" + frame.rows();
            frame.close();
            throw new GeometryException("Frame asset " + asset.getFileName() + " is " + actual
                    + " but the canvas of " + device.id() + " is " + device.canvas());
        }
        if (frame.channels() != 4) {
            frame.close();
            throw new CompositionException("Frame asset " + asset.getFileName()
                    + " has no alpha channel, the screen cutout would be covered");
        }
        if (frame.depth() != opencv_core.CV_8U) {
            Mat eightBit = new Mat();
            try {
                frame.convertTo(eightBit, opencv_core.CV_8U, 1.0 / 257.0, 0);
            } finally {
                frame.close();
            }
            return eightBit;
        }
        return frame;
    }

    private void fillBehindScreen(Mat canvas, DeviceSpec device) {
        int left = Math.max(0, device.screenshotX() - screenFillPadding);
        int top = Math.max(0, device.screenshotY() - screenFillPadding);
        int right = Math.min(canvas.cols(), device.screenshotX() + device.screenshotWidth() + screenFillPadding);
        int bottom = Math.min(canvas.rows(), device.screenshotY() + device.screenshotHeight() + screenFillPadding);
        int width = right - left;
        int height = bottom - top;
        Mat mask = RasterImages.roundedMask(width, height, device.cornerRadius() + screenFillPadding);
        Mat fill = RasterImages.solid(width, height, screenFill);
        try {
            RasterImages.blendInto(canvas, fill, mask, new Rect(left, top, width, height));
        } finally {
            RasterImages.release(fill, mask);
        }
    }
}
