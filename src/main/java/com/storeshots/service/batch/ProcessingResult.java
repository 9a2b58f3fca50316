package com.storeshots.service.batch;

import com.storeshots.exception.ErrorKind;
import com.storeshots.service.catalog.Dimensions;
import java.nio.file.Path;

/**
 * Outcome for one input file. {@code errorKind} is set exactly when the status is
 * {@link ProcessingStatus#FAILED}; {@code output} is the canonical location the file was
 * promoted to and is only set for successes of a promoted run.
 */
public record ProcessingResult(
        String locale,
        Path input,
        Path output,
        ProcessingStatus status,
        ErrorKind errorKind,
        String message,
        String deviceId,
        Dimensions inputDimensions,
        Dimensions outputDimensions) {

    public static ProcessingResult succeeded(String locale, Path input, Path output, String deviceId,
            Dimensions inputDimensions, Dimensions outputDimensions) {
        return new ProcessingResult(locale, input, output, ProcessingStatus.SUCCEEDED, null, null, deviceId,
                inputDimensions, outputDimensions);
    }

    public static ProcessingResult failed(String locale, Path input, ErrorKind kind, String message,
            String deviceId) {
        return new ProcessingResult(locale, input, null, ProcessingStatus.FAILED, kind, message, deviceId,
                null, null);
    }

    public static ProcessingResult skipped(String locale, Path input, String message, String deviceId) {
        return new ProcessingResult(locale, input, null, ProcessingStatus.SKIPPED, null, message, deviceId,
                null, null);
    }

    /**
     * Copy without an output location, for runs whose staged assets were discarded.
     */
    public ProcessingResult unpromoted() {
        if (output == null) {
            return this;
        }
        return new ProcessingResult(locale, input, null, status, errorKind, message, deviceId, inputDimensions,
                outputDimensions);
    }

    public String fileName() {
        return input.getFileName().toString();
    }

    public boolean isSuccess() {
        return status == ProcessingStatus.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == ProcessingStatus.FAILED;
    }
}
