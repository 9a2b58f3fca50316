package com.storeshots.exception;

public class CompositionException extends ScreenshotProcessingException {

    public CompositionException(String message) {
        super(ErrorKind.COMPOSITION_FAILED, message);
    }

    public CompositionException(String message, Throwable cause) {
        super(ErrorKind.COMPOSITION_FAILED, message, cause);
    }

    public CompositionException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
