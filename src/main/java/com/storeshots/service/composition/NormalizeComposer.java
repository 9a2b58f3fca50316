package com.storeshots.service.composition;

import com.storeshots.config.StoreShotsProperties.FrameProperties;
import com.storeshots.service.catalog.DeviceKind;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.raster.RasterImages;
import com.storeshots.service.validation.ImageInspection;
import java.io.IOException;
import java.nio.file.Path;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

/**
 * Brings a capture to the exact store size without any bezel: scale to cover, then crop the
 * overflow evenly from both sides.
 */
public class NormalizeComposer implements Composer {

    private final Scalar background;

    public NormalizeComposer(FrameProperties properties) {
        this.background = RasterImages.color(properties.backgroundColor());
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.NORMALIZE;
    }

    @Override
    public void compose(ImageInspection source, DeviceSpec device, Path target) throws IOException {
        CanvasPlacement cover = CanvasPlacement.cover(source.dimensions(), device.canvas());
        Mat flat = RasterImages.readFlat(source.path(), background);
        Mat scaled = null;
        Mat cropped = null;
        try {
            scaled = RasterImages.resize(flat, cover.width(), cover.height());
            cropped = RasterImages.crop(scaled, cover.x(), cover.y(), device.canvasWidth(), device.canvasHeight());
            RasterImages.write(cropped, target);
        } finally {
            RasterImages.release(cropped, scaled, flat);
        }
    }
}
