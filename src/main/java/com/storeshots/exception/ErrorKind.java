package com.storeshots.exception;

/**
 * Classifies why a single screenshot could not be turned into a store asset. Every failed
 * {@code ProcessingResult} carries exactly one kind so reports can be acted on without
 * re-running the batch.
 */
public enum ErrorKind {
    INPUT_INVALID,
    GEOMETRY_MISMATCH,
    TOOL_UNAVAILABLE,
    COMPOSITION_FAILED,
    OUTPUT_INVALID,
    FRAME_ASSET_MISSING,
    IO_FAILURE,
    CANCELLED
}
