package com.storeshots.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeshots.config.StoreShotsProperties.BatchProperties;
import com.storeshots.config.StoreShotsProperties.CatalogProperties;
import com.storeshots.service.batch.BatchOrchestrator;
import com.storeshots.service.batch.CompletenessCheck;
import com.storeshots.service.batch.DeviceResolver;
import com.storeshots.service.batch.LocaleDiscovery;
import com.storeshots.service.catalog.DeviceCatalog;
import com.storeshots.service.catalog.DeviceCatalogLoader;
import com.storeshots.service.catalog.DeviceSpecAdapter;
import com.storeshots.service.composition.Composer;
import com.storeshots.service.composition.CompositingEngine;
import com.storeshots.service.composition.FrameOverlayComposer;
import com.storeshots.service.composition.GradientCanvasComposer;
import com.storeshots.service.composition.NormalizeComposer;
import com.storeshots.service.raster.OpenCvRasterCapability;
import com.storeshots.service.raster.RasterCapability;
import com.storeshots.service.raster.RasterInvoker;
import com.storeshots.service.validation.ImageValidator;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the pipeline from {@link StoreShotsProperties}. Replace {@link RasterCapability} to run
 * against a different raster backend.
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public DeviceSpecAdapter deviceSpecAdapter(StoreShotsProperties properties) {
        CatalogProperties catalog = properties.catalog();
        Path framesDirectory = Path.of(catalog.framesDirectory()).toAbsolutePath().normalize();
        log.debug("Resolving frame assets against {}", framesDirectory);
        return new DeviceSpecAdapter(framesDirectory, catalog.frameVariant());
    }

    @Bean
    public DeviceCatalogLoader deviceCatalogLoader(ObjectMapper objectMapper, DeviceSpecAdapter adapter) {
        return new DeviceCatalogLoader(objectMapper, adapter);
    }

    @Bean
    public DeviceCatalog deviceCatalog(DeviceCatalogLoader loader, ResourceLoader resourceLoader,
            StoreShotsProperties properties) {
        return loader.loadCatalog(resourceLoader.getResource(properties.catalog().location()));
    }

    @Bean
    public ImageValidator imageValidator(StoreShotsProperties properties) {
        return new ImageValidator(properties.validation());
    }

    @Bean
    public RasterCapability rasterCapability(StoreShotsProperties properties) {
        return new OpenCvRasterCapability(properties.batch().extensions());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService rasterExecutor(StoreShotsProperties properties) {
        return Executors.newFixedThreadPool(poolSize(properties.batch()), new CustomizableThreadFactory("raster-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService batchExecutor(StoreShotsProperties properties) {
        return Executors.newFixedThreadPool(poolSize(properties.batch()), new CustomizableThreadFactory("batch-"));
    }

    @Bean
    public RasterInvoker rasterInvoker(@Qualifier("rasterExecutor") ExecutorService rasterExecutor,
            StoreShotsProperties properties) {
        return new RasterInvoker(rasterExecutor, properties.batch().timeout());
    }

    @Bean
    public CompositingEngine compositingEngine(ImageValidator validator, RasterInvoker invoker,
            StoreShotsProperties properties) {
        List<Composer> composers = List.of(
                new GradientCanvasComposer(properties.gradient()),
                new FrameOverlayComposer(properties.frame()),
                new NormalizeComposer(properties.frame()));
        return new CompositingEngine(validator, invoker, composers);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(DeviceCatalog catalog, ImageValidator validator,
            CompositingEngine engine, RasterCapability capability,
            @Qualifier("batchExecutor") ExecutorService batchExecutor, StoreShotsProperties properties) {
        LocaleDiscovery discovery = new LocaleDiscovery(properties.batch());
        DeviceResolver resolver = new DeviceResolver(catalog, validator, properties.catalog().defaultDevice());
        CompletenessCheck completeness = new CompletenessCheck(catalog, properties.batch().completeness());
        return new BatchOrchestrator(discovery, resolver, engine, capability, completeness, batchExecutor);
    }

    private static int poolSize(BatchProperties batch) {
        return Math.max(1, batch.workers());
    }
}
