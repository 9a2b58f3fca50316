package com.storeshots.service.batch;

import com.storeshots.config.StoreShotsProperties.BatchProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates {@code <input>/<locale>/*.<ext>}. Locales are whatever subdirectories exist,
 * sorted by name; nothing is hard-coded.
 */
public class LocaleDiscovery {

    private static final Logger log = LoggerFactory.getLogger(LocaleDiscovery.class);

    private final Set<String> extensions;
    private final Set<String> excludedDirectories;

    public LocaleDiscovery(BatchProperties properties) {
        this.extensions = lowerCase(properties.extensions());
        this.excludedDirectories = lowerCase(properties.excludedDirectories());
    }

    public List<LocaleBatch> discover(Path inputRoot, Path outputRoot) throws IOException {
        Path output = outputRoot.toAbsolutePath().normalize();
        List<Path> directories;
        try (Stream<Path> children = Files.list(inputRoot)) {
            directories = children
                    .filter(Files::isDirectory)
                    .filter(directory -> !isHidden(directory))
                    .filter(directory -> !excludedDirectories.contains(name(directory).toLowerCase(Locale.ROOT)))
                    .filter(directory -> !directory.toAbsolutePath().normalize().equals(output))
                    .sorted(Comparator.comparing(LocaleDiscovery::name))
                    .toList();
        }

        List<LocaleBatch> locales = new ArrayList<>(directories.size());
        for (Path directory : directories) {
            List<Path> files;
            try (Stream<Path> entries = Files.list(directory)) {
                files = entries
                        .filter(Files::isRegularFile)
                        .filter(file -> !isHidden(file))
                        .filter(this::hasAcceptedExtension)
                        .sorted(Comparator.comparing(LocaleDiscovery::name))
                        .toList();
            }
            if (files.isEmpty()) {
                log.debug("Locale {} has no screenshots", name(directory));
            }
            locales.add(new LocaleBatch(name(directory), directory, files));
        }
        log.debug("Discovered {} locale(s) under {}", locales.size(), inputRoot);
        return locales;
    }

    private boolean hasAcceptedExtension(Path file) {
        String fileName = name(file);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean isHidden(Path path) {
        return name(path).startsWith(".");
    }

    private static String name(Path path) {
        return path.getFileName().toString();
    }

    private static Set<String> lowerCase(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .collect(Collectors.toUnmodifiableSet());
    }
}
