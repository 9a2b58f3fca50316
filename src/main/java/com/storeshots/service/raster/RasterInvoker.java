package com.storeshots.service.raster;

import com.storeshots.exception.CapabilityUnavailableException;
import com.storeshots.exception.CompositionException;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.ScreenshotProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs native raster work on a dedicated bounded pool and translates whatever comes back into
 * the processing exception hierarchy. A call that exceeds the timeout is abandoned; the only
 * thing it can still touch is its own hidden part file.
 */
public class RasterInvoker {

    private static final Logger log = LoggerFactory.getLogger(RasterInvoker.class);

    private final ExecutorService executor;
    private final Duration timeout;

    public RasterInvoker(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T invoke(String operation, Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("{} exceeded {} ms and was abandoned", operation, timeout.toMillis());
            throw new CompositionException(operation + " timed out after " + timeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScreenshotProcessingException(ErrorKind.CANCELLED, operation + " was interrupted", ex);
        } catch (ExecutionException ex) {
            throw translate(operation, ex.getCause());
        }
    }

    private static RuntimeException translate(String operation, Throwable cause) {
        if (cause instanceof ScreenshotProcessingException) {
            return (ScreenshotProcessingException) cause;
        }
        if (cause instanceof LinkageError) {
            return new CapabilityUnavailableException(operation + " could not reach the native raster library: "
                    + cause, cause);
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return new ScreenshotProcessingException(ErrorKind.IO_FAILURE, operation + " failed: " + cause.getMessage(),
                    cause);
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new CompositionException(operation + " failed: " + cause, cause);
    }
}
