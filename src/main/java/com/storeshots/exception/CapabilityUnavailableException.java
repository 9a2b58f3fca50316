package com.storeshots.exception;

/**
 * The native raster library cannot be invoked at all. Unlike every other failure this one is
 * fatal for the whole run.
 */
public class CapabilityUnavailableException extends ScreenshotProcessingException {

    public CapabilityUnavailableException(String message) {
        super(ErrorKind.TOOL_UNAVAILABLE, message);
    }

    public CapabilityUnavailableException(String message, Throwable cause) {
        super(ErrorKind.TOOL_UNAVAILABLE, message, cause);
    }
}
