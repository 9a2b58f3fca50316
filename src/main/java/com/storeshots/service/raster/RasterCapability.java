package com.storeshots.service.raster;

/**
 * The native raster library the composers depend on. Probed once before a batch touches the
 * file system so a broken installation fails fast instead of producing a run full of
 * identical failures.
 */
public interface RasterCapability {

    /**
     * @throws com.storeshots.exception.CapabilityUnavailableException when the library cannot
     *         be loaded or cannot encode the output formats
     */
    void probe();

    String describe();
}
