package com.storeshots.exception;

/**
 * Raised when an input screenshot or a produced asset fails a structural check.
 */
public class ValidationException extends ScreenshotProcessingException {

    public ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public ValidationException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static ValidationException input(String message) {
        return new ValidationException(ErrorKind.INPUT_INVALID, message);
    }

    public static ValidationException output(String message) {
        return new ValidationException(ErrorKind.OUTPUT_INVALID, message);
    }
}
