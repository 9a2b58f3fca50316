package com.storeshots.service.batch;

import java.time.Duration;
import java.util.List;

/**
 * Final account of one run.
 *
 * @param promoted       whether the canonical output directory was replaced
 * @param aborted        the raster capability disappeared mid-run and outstanding work was dropped
 * @param promotionError I/O failure during promotion, {@code null} when none occurred
 * @param incomplete     locales that produced fewer assets for a device than configured
 * @param completenessEnforced whether {@code incomplete} entries count as failures
 */
public record BatchReport(
        String runId,
        PromotionMode mode,
        boolean dryRun,
        List<ProcessingResult> results,
        boolean promoted,
        boolean aborted,
        String promotionError,
        Duration elapsed,
        List<CompletenessGap> incomplete,
        boolean completenessEnforced) {

    public BatchReport {
        results = List.copyOf(results);
        incomplete = List.copyOf(incomplete);
    }

    public BatchReport(String runId, PromotionMode mode, boolean dryRun, List<ProcessingResult> results,
            boolean promoted, boolean aborted, String promotionError, Duration elapsed) {
        this(runId, mode, dryRun, results, promoted, aborted, promotionError, elapsed, List.of(), false);
    }

    public long succeeded() {
        return count(ProcessingStatus.SUCCEEDED);
    }

    public long failed() {
        return count(ProcessingStatus.FAILED);
    }

    public long skipped() {
        return count(ProcessingStatus.SKIPPED);
    }

    public List<ProcessingResult> failures() {
        return results.stream().filter(ProcessingResult::isFailure).toList();
    }

    public boolean hasFailures() {
        return failed() > 0 || promotionError != null || (completenessEnforced && !incomplete.isEmpty());
    }

    private long count(ProcessingStatus status) {
        return results.stream().filter(result -> result.status() == status).count();
    }
}
