package com.storeshots.service.batch;

import com.storeshots.exception.CapabilityUnavailableException;
import com.storeshots.exception.ErrorKind;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a submitted batch. Work for individual locales can be cancelled while the batch
 * runs. Cancellation only marks the locale: tasks that have not started yet report themselves as
 * cancelled and a file already being composed is allowed to finish. {@link #awaitReport()} joins
 * every task before it applies the promotion policy and discards the staging tree.
 */
public class BatchExecution {

    private static final Logger log = LoggerFactory.getLogger(BatchExecution.class);

    private final BatchRequest request;
    private final String runId;
    private final List<LocaleBatch> locales;
    private final StagingArea staging;
    private final Instant started;
    private final ResultLedger ledger = new ResultLedger();
    private final CompletenessCheck completeness;
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final Set<String> cancelledLocales = ConcurrentHashMap.newKeySet();
    private final AtomicReference<CapabilityUnavailableException> abortCause = new AtomicReference<>();

    private BatchReport report;

    BatchExecution(BatchRequest request, String runId, List<LocaleBatch> locales, StagingArea staging,
            CompletenessCheck completeness, Instant started) {
        this.request = request;
        this.runId = runId;
        this.locales = List.copyOf(locales);
        this.staging = staging;
        this.completeness = completeness;
        this.started = started;
    }

    static BatchExecution completed(BatchReport report) {
        BatchExecution execution = new BatchExecution(null, report.runId(), List.of(), null,
                CompletenessCheck.disabled(), Instant.now());
        execution.report = report;
        return execution;
    }

    public String runId() {
        return runId;
    }

    /**
     * Cancels the pending work of one locale. Files already being composed finish; everything
     * not yet started is reported as {@link ErrorKind#CANCELLED}.
     *
     * @return {@code false} when the locale is unknown to this run
     */
    public boolean cancelLocale(String locale) {
        if (locales.stream().noneMatch(batch -> batch.locale().equals(locale))) {
            return false;
        }
        if (cancelledLocales.add(locale)) {
            log.info("Cancelling remaining work for locale {}", locale);
        }
        return true;
    }

    public boolean isCancelled(String locale) {
        return cancelledLocales.contains(locale);
    }

    public boolean isAborted() {
        return abortCause.get() != null;
    }

    public synchronized BatchReport awaitReport() {
        if (report != null) {
            return report;
        }
        try {
            waitForWorkers();
            recordUnprocessedFiles();
            List<ProcessingResult> results = ledger.results();
            List<CompletenessGap> incomplete = completeness.check(locales, results);
            boolean aborted = isAborted();
            String promotionError = null;
            boolean promoted = false;
            if (aborted) {
                log.error("Run {} aborted: {}", runId, abortCause.get().getMessage());
            } else {
                try {
                    promoted = promote(results, incomplete);
                } catch (IOException ex) {
                    promotionError = "Promotion to " + staging.outputRoot() + " failed: " + ex.getMessage();
                    log.error(promotionError, ex);
                }
            }
            if (!promoted) {
                results = results.stream().map(ProcessingResult::unpromoted).toList();
            }
            report = new BatchReport(runId, request.mode(), false, results, promoted, aborted, promotionError,
                    Duration.between(started, Instant.now()), incomplete, completeness.enforced());
            return report;
        } finally {
            staging.discard();
        }
    }

    void track(Future<?> future) {
        futures.add(future);
    }

    void abort(CapabilityUnavailableException cause) {
        if (abortCause.compareAndSet(null, cause)) {
            log.error("Raster capability lost, cancelling all outstanding work: {}", cause.getMessage());
        }
    }

    ResultLedger ledger() {
        return ledger;
    }

    BatchRequest request() {
        return request;
    }

    StagingArea staging() {
        return staging;
    }

    private void waitForWorkers() {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (CancellationException ex) {
                    log.debug("Task cancelled before it started");
                    break;
                } catch (ExecutionException ex) {
                    log.error("Worker task escaped its failure handling", ex.getCause());
                    break;
                } catch (InterruptedException ex) {
                    if (!interrupted) {
                        log.warn("Interrupted while waiting for run {}; cancelling work not yet started", runId);
                        locales.forEach(batch -> cancelledLocales.add(batch.locale()));
                    }
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void recordUnprocessedFiles() {
        for (LocaleBatch batch : locales) {
            for (Path file : batch.files()) {
                if (!ledger.contains(batch.locale(), file.getFileName().toString())) {
                    String reason = isAborted() ? "run aborted: raster capability unavailable" : "cancelled";
                    ledger.record(ProcessingResult.failed(batch.locale(), file, ErrorKind.CANCELLED, reason, null));
                }
            }
        }
    }

    private boolean promote(List<ProcessingResult> results, List<CompletenessGap> incomplete)
            throws IOException {
        long succeeded = results.stream().filter(ProcessingResult::isSuccess).count();
        long failed = results.stream().filter(ProcessingResult::isFailure).count();
        if (succeeded == 0) {
            log.warn("Run {} produced no assets; {} left untouched", runId, staging.outputRoot());
            return false;
        }
        if (request.mode() == PromotionMode.STRICT) {
            if (failed > 0) {
                log.warn("Run {} had {} failure(s); strict mode leaves {} untouched", runId, failed,
                        staging.outputRoot());
                return false;
            }
            if (completeness.enforced() && !incomplete.isEmpty()) {
                log.warn("Run {} left {} locale/device combination(s) incomplete; strict mode leaves {} untouched",
                        runId, incomplete.size(), staging.outputRoot());
                return false;
            }
            staging.promoteAll();
            return true;
        }
        List<Path> staged = new ArrayList<>();
        for (ProcessingResult result : results) {
            if (result.isSuccess()) {
                staged.add(Path.of(result.locale(), result.fileName()));
            }
        }
        staging.promoteOverlay(staged);
        if (failed > 0) {
            log.warn("Run {} promoted {} asset(s) with {} failure(s)", runId, succeeded, failed);
        }
        return true;
    }
}
