package com.storeshots.service.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeshots.exception.CatalogException;
import com.storeshots.service.catalog.CatalogDocument.DeviceRecord;
import com.storeshots.service.catalog.CatalogDocument.LegacyDeviceRecord;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads and validates a device catalog. Per-record checks live in {@link DeviceSpecAdapter};
 * this class owns the document level and the cross-device rules.
 */
public class DeviceCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(DeviceCatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final DeviceSpecAdapter adapter;

    public DeviceCatalogLoader(ObjectMapper objectMapper, DeviceSpecAdapter adapter) {
        this.objectMapper = objectMapper;
        this.adapter = adapter;
    }

    public DeviceCatalog loadCatalog(Resource source) {
        if (source == null || !source.exists()) {
            throw new CatalogException("Device catalog not found: " + source);
        }
        try (InputStream in = source.getInputStream()) {
            DeviceCatalog catalog = parse(objectMapper.readTree(in), source.getDescription());
            log.info("Loaded {} device specs from {}", catalog.size(), source.getDescription());
            return catalog;
        } catch (JsonProcessingException ex) {
            throw new CatalogException("Device catalog " + source.getDescription() + " is not valid JSON: "
                    + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new CatalogException("Unable to read device catalog " + source.getDescription(), ex);
        }
    }

    DeviceCatalog parse(JsonNode root, String description) throws JsonProcessingException {
        if (root == null || !root.isObject()) {
            throw new CatalogException("Device catalog " + description + " must be a JSON object");
        }
        int version = root.path("version").asInt(CatalogDocument.CURRENT_VERSION);
        if (version != CatalogDocument.LEGACY_VERSION && version != CatalogDocument.CURRENT_VERSION) {
            throw new CatalogException("Unsupported catalog version " + version + " in " + description);
        }
        JsonNode entries = root.path("devices");
        if (!entries.isArray() || entries.isEmpty()) {
            throw new CatalogException("Device catalog " + description + " defines no devices");
        }

        List<DeviceSpec> devices = new ArrayList<>();
        for (JsonNode entry : entries) {
            DeviceRecord record = version == CatalogDocument.LEGACY_VERSION
                    ? adapter.upgrade(objectMapper.treeToValue(entry, LegacyDeviceRecord.class))
                    : objectMapper.treeToValue(entry, DeviceRecord.class);
            devices.add(adapter.toSpec(record));
        }
        checkUniqueness(devices);
        return new DeviceCatalog(devices);
    }

    private static void checkUniqueness(List<DeviceSpec> devices) {
        Set<String> ids = new HashSet<>();
        Map<Dimensions, String> claimed = new HashMap<>();
        for (DeviceSpec device : devices) {
            if (!ids.add(device.id().toLowerCase(Locale.ROOT))) {
                throw new CatalogException("Duplicate device id '" + device.id() + "'");
            }
            for (Dimensions dimensions : device.rawDimensions()) {
                String owner = claimed.putIfAbsent(dimensions, device.id());
                if (owner != null && !owner.equals(device.id())) {
                    throw new CatalogException("Raw size " + dimensions + " is claimed by both '" + owner
                            + "' and '" + device.id() + "'");
                }
            }
        }
    }
}
