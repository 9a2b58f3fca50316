package com.storeshots.exception;

public class GeometryException extends ScreenshotProcessingException {

    public GeometryException(String message) {
        super(ErrorKind.GEOMETRY_MISMATCH, message);
    }
}
