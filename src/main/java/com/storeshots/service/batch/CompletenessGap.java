package com.storeshots.service.batch;

/**
 * A locale that produced fewer assets for a device than configured.
 */
public record CompletenessGap(String locale, String deviceId, int expected, int actual) {
}
