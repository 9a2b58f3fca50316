package com.storeshots.service.batch;

import com.storeshots.config.StoreShotsProperties.CompletenessProperties;
import com.storeshots.exception.CatalogException;
import com.storeshots.service.catalog.DeviceCatalog;
import com.storeshots.service.catalog.DeviceSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the assets each discovered locale produced per device and reports the locales that
 * fall short of the configured minimum. A result counts when it carries a device and did not
 * fail, so dry-run plans are measured the same way as real runs.
 */
public class CompletenessCheck {

    private static final Logger log = LoggerFactory.getLogger(CompletenessCheck.class);

    private final Map<String, Integer> expected;
    private final boolean enforced;

    public CompletenessCheck(DeviceCatalog catalog, CompletenessProperties properties) {
        Map<String, Integer> resolved = new TreeMap<>();
        if (properties != null && properties.expected() != null) {
            properties.expected().forEach((device, count) -> {
                DeviceSpec spec = catalog.resolveByName(device)
                        .orElseThrow(() -> new CatalogException("Completeness check names unknown device '"
                                + device + "'"));
                if (count == null || count < 0) {
                    throw new CatalogException("Expected asset count for " + device + " must not be negative");
                }
                if (count > 0) {
                    resolved.put(spec.id(), count);
                }
            });
        }
        this.expected = Collections.unmodifiableMap(resolved);
        this.enforced = properties != null && properties.enforce() && !resolved.isEmpty();
    }

    private CompletenessCheck() {
        this.expected = Map.of();
        this.enforced = false;
    }

    public static CompletenessCheck disabled() {
        return new CompletenessCheck();
    }

    public boolean enforced() {
        return enforced;
    }

    public List<CompletenessGap> check(List<LocaleBatch> locales, List<ProcessingResult> results) {
        if (expected.isEmpty()) {
            return List.of();
        }
        List<CompletenessGap> gaps = new ArrayList<>();
        for (LocaleBatch batch : locales) {
            for (Map.Entry<String, Integer> entry : expected.entrySet()) {
                int actual = (int) results.stream()
                        .filter(result -> result.locale().equals(batch.locale()))
                        .filter(result -> entry.getKey().equals(result.deviceId()) && !result.isFailure())
                        .count();
                if (actual < entry.getValue()) {
                    log.warn("Locale {} has {} of {} expected {} asset(s)", batch.locale(), actual, entry.getValue(),
                            entry.getKey());
                    gaps.add(new CompletenessGap(batch.locale(), entry.getKey(), entry.getValue(), actual));
                }
            }
        }
        return gaps;
    }
}
