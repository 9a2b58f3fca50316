package com.storeshots.exception;

/**
 * Bad command line arguments or an input root that cannot be read.
 */
public class InvalidInvocationException extends RuntimeException {

    public InvalidInvocationException(String message) {
        super(message);
    }
}
