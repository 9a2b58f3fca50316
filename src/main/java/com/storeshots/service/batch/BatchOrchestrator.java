package com.storeshots.service.batch;

import com.storeshots.exception.CapabilityUnavailableException;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.InvalidInvocationException;
import com.storeshots.exception.ScreenshotProcessingException;
import com.storeshots.service.catalog.DeviceSpec;
import com.storeshots.service.composition.CompositingEngine;
import com.storeshots.service.composition.CompositionOutcome;
import com.storeshots.service.raster.RasterCapability;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs discover, process, validate, decide and report over every locale under an input root.
 * Per-file failures are recorded against that file and never stop the batch; only a lost
 * raster capability aborts the run.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final LocaleDiscovery discovery;
    private final DeviceResolver resolver;
    private final CompositingEngine engine;
    private final RasterCapability capability;
    private final CompletenessCheck completeness;
    private final ExecutorService workers;

    public BatchOrchestrator(LocaleDiscovery discovery, DeviceResolver resolver, CompositingEngine engine,
            RasterCapability capability, CompletenessCheck completeness, ExecutorService workers) {
        this.discovery = discovery;
        this.resolver = resolver;
        this.engine = engine;
        this.capability = capability;
        this.completeness = completeness;
        this.workers = workers;
    }

    public BatchReport run(BatchRequest request) {
        return submit(request).awaitReport();
    }

    /**
     * Starts a batch and returns immediately after scheduling.
     *
     * @throws InvalidInvocationException     when the input root is unusable or the forced
     *                                        device is unknown
     * @throws CapabilityUnavailableException when the raster library cannot be used; nothing
     *                                        has been written at that point
     */
    public BatchExecution submit(BatchRequest request) {
        Instant started = Instant.now();
        Path inputRoot = request.inputRoot();
        if (!Files.isDirectory(inputRoot)) {
            throw new InvalidInvocationException("Input directory does not exist: " + inputRoot);
        }
        if (!Files.isReadable(inputRoot)) {
            throw new InvalidInvocationException("Input directory is not readable: " + inputRoot);
        }
        DeviceSpec forced = null;
        if (request.forcedDevice() != null) {
            forced = resolver.lookup(request.forcedDevice())
                    .orElseThrow(() -> new InvalidInvocationException("Unknown device '" + request.forcedDevice()
                            + "'"));
        }
        if (!request.dryRun()) {
            capability.probe();
            log.debug("Raster backend: {}", capability.describe());
        }

        String runId = LocalDateTime.now().format(RUN_ID_FORMAT) + "-" + UUID.randomUUID().toString().substring(0, 8);
        List<LocaleBatch> locales;
        try {
            locales = discovery.discover(inputRoot, request.outputRoot());
        } catch (IOException ex) {
            throw new InvalidInvocationException("Unable to list " + inputRoot + ": " + ex.getMessage());
        }
        int total = locales.stream().mapToInt(batch -> batch.files().size()).sum();
        log.info("Run {}: {} screenshot(s) in {} locale(s), mode {}{}", runId, total, locales.size(),
                request.mode(), request.dryRun() ? ", dry run" : "");

        if (total == 0) {
            log.warn("No screenshots found under {}", inputRoot);
            return BatchExecution.completed(new BatchReport(runId, request.mode(), request.dryRun(), List.of(),
                    false, false, null, Duration.between(started, Instant.now())));
        }
        if (request.dryRun()) {
            List<ProcessingResult> planned = plan(locales, forced);
            return BatchExecution.completed(new BatchReport(runId, request.mode(), true, planned, false, false,
                    null, Duration.between(started, Instant.now()), completeness.check(locales, planned), false));
        }

        StagingArea staging;
        try {
            staging = StagingArea.create(request.outputRoot(), runId);
        } catch (IOException ex) {
            throw new InvalidInvocationException("Unable to create staging area next to " + request.outputRoot()
                    + ": " + ex.getMessage());
        }
        BatchExecution execution = new BatchExecution(request, runId, locales, staging, completeness, started);
        DeviceSpec device = forced;
        for (LocaleBatch batch : locales) {
            for (Path file : batch.files()) {
                execution.track(workers.submit(() -> process(execution, batch.locale(), file, device)));
            }
        }
        return execution;
    }

    private List<ProcessingResult> plan(List<LocaleBatch> locales, DeviceSpec forced) {
        List<ProcessingResult> planned = new ArrayList<>();
        for (LocaleBatch batch : locales) {
            for (Path file : batch.files()) {
                try {
                    Optional<DeviceSpec> device = resolver.resolve(file, forced);
                    String message = device.map(spec -> "dry run: would compose for " + spec.id())
                            .orElse("dry run: no device matches");
                    log.info("{}/{}: {}", batch.locale(), file.getFileName(), message);
                    planned.add(ProcessingResult.skipped(batch.locale(), file, message,
                            device.map(DeviceSpec::id).orElse(null)));
                } catch (ScreenshotProcessingException ex) {
                    log.warn("{}/{}: dry run would fail [{}]: {}", batch.locale(), file.getFileName(), ex.kind(),
                            ex.getMessage());
                    planned.add(ProcessingResult.skipped(batch.locale(), file,
                            "dry run: would fail [" + ex.kind() + "] " + ex.getMessage(), null));
                }
            }
        }
        return planned;
    }

    private void process(BatchExecution execution, String locale, Path file, DeviceSpec forced) {
        String fileName = file.getFileName().toString();
        if (execution.isAborted() || execution.isCancelled(locale)) {
            String reason = execution.isAborted() ? "run aborted: raster capability unavailable" : "cancelled";
            execution.ledger().record(ProcessingResult.failed(locale, file, ErrorKind.CANCELLED, reason, null));
            return;
        }
        String deviceId = null;
        try {
            Optional<DeviceSpec> device = resolver.resolve(file, forced);
            if (device.isEmpty()) {
                log.warn("{}/{}: no device matches, skipping", locale, fileName);
                execution.ledger().record(ProcessingResult.skipped(locale, file, "no device matches", null));
                return;
            }
            DeviceSpec spec = device.get();
            deviceId = spec.id();
            Path staged = execution.staging().localeDirectory(locale).resolve(fileName);
            CompositionOutcome outcome = engine.compose(file, staged, spec);
            Path canonical = execution.staging().outputRoot().resolve(locale).resolve(fileName);
            execution.ledger().record(ProcessingResult.succeeded(locale, file, canonical, spec.id(),
                    outcome.inputDimensions(), outcome.outputDimensions()));
            log.info("{}/{}: {} -> {} ({})", locale, fileName, outcome.inputDimensions(),
                    outcome.outputDimensions(), spec.id());
        } catch (CapabilityUnavailableException ex) {
            execution.ledger().record(ProcessingResult.failed(locale, file, ex.kind(), ex.getMessage(), deviceId));
            execution.abort(ex);
        } catch (ScreenshotProcessingException ex) {
            log.warn("{}/{} failed [{}]: {}", locale, fileName, ex.kind(), ex.getMessage());
            execution.ledger().record(ProcessingResult.failed(locale, file, ex.kind(), ex.getMessage(), deviceId));
        } catch (IOException ex) {
            log.warn("{}/{} failed [{}]: {}", locale, fileName, ErrorKind.IO_FAILURE, ex.getMessage());
            execution.ledger().record(ProcessingResult.failed(locale, file, ErrorKind.IO_FAILURE, ex.getMessage(),
                    deviceId));
        } catch (RuntimeException ex) {
            log.error("{}/{} failed unexpectedly", locale, fileName, ex);
            execution.ledger().record(ProcessingResult.failed(locale, file, ErrorKind.COMPOSITION_FAILED,
                    String.valueOf(ex.getMessage()), deviceId));
        }
    }
}
