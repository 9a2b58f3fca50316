package com.storeshots.service.batch;

import com.storeshots.exception.CatalogException;
import com.storeshots.service.catalog.DeviceCatalog;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.validation.ImageInspection;
import com.storeshots.service.validation.ImageValidator;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the target device for a screenshot: a forced device wins, then the file name pattern,
 * then the raw capture size read from the image header, then the configured default.
 */
public class DeviceResolver {

    private static final Logger log = LoggerFactory.getLogger(DeviceResolver.class);

    private final DeviceCatalog catalog;
    private final ImageValidator validator;
    private final DeviceSpec defaultDevice;

    public DeviceResolver(DeviceCatalog catalog, ImageValidator validator, String defaultDevice) {
        this.catalog = catalog;
        this.validator = validator;
        if (defaultDevice == null || defaultDevice.isBlank()) {
            this.defaultDevice = null;
        } else {
            this.defaultDevice = catalog.resolveByName(defaultDevice)
                    .orElseThrow(() -> new CatalogException("Default device '" + defaultDevice
                            + "' is not in the catalog"));
        }
    }

    public Optional<DeviceSpec> lookup(String identifier) {
        return catalog.resolveByName(identifier);
    }

    /**
     * @throws com.storeshots.exception.ValidationException when the header has to be read and
     *         the file is not a decodable image
     */
    public Optional<DeviceSpec> resolve(Path file, DeviceSpec forced) {
        if (forced != null) {
            return Optional.of(forced);
        }
        String fileName = file.getFileName().toString();
        Optional<DeviceSpec> byName = catalog.resolveByFilename(fileName);
        if (byName.isPresent()) {
            log.debug("{} matched {} by file name", fileName, byName.get().id());
            return byName;
        }
        ImageInspection header = validator.inspectHeader(file);
        Optional<DeviceSpec> bySize = catalog.resolveByDimensions(header.width(), header.height());
        if (bySize.isPresent()) {
            log.debug("{} matched {} by capture size {}", fileName, bySize.get().id(), header.dimensions());
            return bySize;
        }
        if (defaultDevice != null) {
            log.debug("{} ({}) falls back to default device {}", fileName, header.dimensions(), defaultDevice.id());
        }
        return Optional.ofNullable(defaultDevice);
    }
}
