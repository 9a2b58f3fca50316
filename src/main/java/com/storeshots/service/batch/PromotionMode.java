package com.storeshots.service.batch;

import java.util.Locale;

/**
 * Decides what reaches the canonical output directory at the end of a run.
 */
public enum PromotionMode {

    /** Promote only when every processed file succeeded; otherwise leave the previous output untouched. */
    STRICT,

    /** Promote every success on top of the previous output and report the failures. */
    BEST_EFFORT;

    public static PromotionMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Promotion mode must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PromotionMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown promotion mode '" + value + "', expected strict or best-effort");
    }
}
