package com.storeshots.service.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table over the loaded device specs. Instances are built by
 * {@link DeviceCatalogLoader}, which guarantees ids are unique and that no two devices claim
 * the same raw capture size.
 */
public class DeviceCatalog {

    private final List<DeviceSpec> devices;
    private final Map<String, DeviceSpec> byKey;
    private final Map<Dimensions, DeviceSpec> byRawDimensions;

    DeviceCatalog(List<DeviceSpec> devices) {
        this.devices = List.copyOf(devices);
        Map<String, DeviceSpec> keys = new LinkedHashMap<>();
        Map<Dimensions, DeviceSpec> raw = new LinkedHashMap<>();
        for (DeviceSpec device : this.devices) {
            keys.put(key(device.id()), device);
            keys.putIfAbsent(key(device.name()), device);
            device.rawDimensions().forEach(dimensions -> raw.put(dimensions, device));
        }
        this.byKey = Collections.unmodifiableMap(keys);
        this.byRawDimensions = Collections.unmodifiableMap(raw);
    }

    public List<DeviceSpec> devices() {
        return devices;
    }

    public Optional<DeviceSpec> resolveByName(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key(identifier)));
    }

    public Optional<DeviceSpec> resolveByDimensions(int width, int height) {
        return Optional.ofNullable(byRawDimensions.get(new Dimensions(width, height)));
    }

    public Optional<DeviceSpec> resolveByFilename(String filename) {
        return devices.stream()
                .filter(device -> device.matchesFilename(filename))
                .findFirst();
    }

    public int size() {
        return devices.size();
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
