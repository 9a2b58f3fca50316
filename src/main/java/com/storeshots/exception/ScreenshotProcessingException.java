package com.storeshots.exception;

import java.util.Objects;

public class ScreenshotProcessingException extends RuntimeException {

    private final ErrorKind kind;

    public ScreenshotProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ScreenshotProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
