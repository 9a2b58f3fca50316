package com.storeshots.service.raster;

import com.storeshots.exception.CapabilityUnavailableException;
import java.util.List;
import java.util.Locale;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OpenCvRasterCapability implements RasterCapability {

    private static final Logger log = LoggerFactory.getLogger(OpenCvRasterCapability.class);

    private final List<String> requiredWriters;
    private volatile String version;

    public OpenCvRasterCapability(List<String> extensions) {
        this.requiredWriters = extensions.stream()
                .map(extension -> "." + extension.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public void probe() {
        if (version != null) {
            return;
        }
        try {
            Loader.load(opencv_core.class);
            Loader.load(opencv_imgproc.class);
            Loader.load(opencv_imgcodecs.class);
            for (String writer : requiredWriters) {
                if (!opencv_imgcodecs.haveImageWriter(writer)) {
                    throw new CapabilityUnavailableException("OpenCV build has no encoder for " + writer);
                }
            }
            version = opencv_core.getVersionMajor() + "." + opencv_core.getVersionMinor() + "."
                    + opencv_core.getVersionRevision();
            log.info("OpenCV {} available for {}", version, requiredWriters);
        } catch (LinkageError error) {
            throw new CapabilityUnavailableException("Unable to load the OpenCV native libraries: " + error, error);
        } catch (CapabilityUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CapabilityUnavailableException("OpenCV probe failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String describe() {
        return version == null ? "OpenCV (not probed)" : "OpenCV " + version;
    }
}
