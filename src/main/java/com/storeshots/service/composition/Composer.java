package com.storeshots.service.composition;

import com.storeshots.service.catalog.DeviceKind;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.validation.ImageInspection;
import java.io.IOException;
import java.nio.file.Path;

/**
 * One composition strategy. Implementations run on the raster invoker's threads and write a
 * flattened image of exactly the device canvas size to {@code target}.
 */
public interface Composer {

    DeviceKind kind();

    void compose(ImageInspection source, DeviceSpec device, Path target) throws IOException;
}
