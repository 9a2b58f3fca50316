package com.storeshots.service.batch;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagingAreaTest {

    @TempDir
    Path dir;

    @Test
    void stagingIsAHiddenSiblingOfTheOutput() throws IOException {
        StagingArea staging = StagingArea.create(dir.resolve("processed"), "run-1");

        assertThat(staging.root()).isEqualTo(dir.toAbsolutePath().resolve(".processed.staging-run-1"));
        assertThat(staging.root()).isDirectory();
        assertThat(staging.localeDirectory("en-US")).isDirectory();
        assertThat(dir.resolve("processed")).doesNotExist();
    }

    @Test
    void promoteAllReplacesTheWholeTree() throws IOException {
        write(dir.resolve("processed/de-DE/stale.png"), "old");
        StagingArea staging = StagingArea.create(dir.resolve("processed"), "run-2");
        write(staging.localeDirectory("en-US").resolve("01.png"), "new");

        staging.promoteAll();

        assertThat(dir.resolve("processed/en-US/01.png")).hasContent("new");
        assertThat(dir.resolve("processed/de-DE")).doesNotExist();
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void overlayKeepsFilesThatWereNotRendered() throws IOException {
        write(dir.resolve("processed/en-US/01.png"), "old-01");
        write(dir.resolve("processed/en-US/02.png"), "old-02");
        StagingArea staging = StagingArea.create(dir.resolve("processed"), "run-3");
        write(staging.localeDirectory("en-US").resolve("01.png"), "new-01");
        write(staging.localeDirectory("fr-FR").resolve("01.png"), "new-fr");

        staging.promoteOverlay(List.of(Path.of("en-US", "01.png"), Path.of("fr-FR", "01.png")));
        staging.discard();

        assertThat(dir.resolve("processed/en-US/01.png")).hasContent("new-01");
        assertThat(dir.resolve("processed/en-US/02.png")).hasContent("old-02");
        assertThat(dir.resolve("processed/fr-FR/01.png")).hasContent("new-fr");
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void overlayCreatesTheOutputWhenThereWasNone() throws IOException {
        StagingArea staging = StagingArea.create(dir.resolve("processed"), "run-4");
        write(staging.localeDirectory("en-US").resolve("01.png"), "new");

        staging.promoteOverlay(List.of(Path.of("en-US", "01.png")));

        assertThat(dir.resolve("processed/en-US/01.png")).hasContent("new");
    }

    @Test
    void discardLeavesTheCanonicalTreeAlone() throws IOException {
        write(dir.resolve("processed/en-US/01.png"), "old");
        StagingArea staging = StagingArea.create(dir.resolve("processed"), "run-5");
        write(staging.localeDirectory("en-US").resolve("01.png"), "new");

        staging.discard();

        assertThat(dir.resolve("processed/en-US/01.png")).hasContent("old");
        assertThat(hiddenEntries()).isEmpty();
    }

    private List<String> hiddenEntries() throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.map(path -> path.getFileName().toString()).filter(name -> name.startsWith(".")).toList();
        }
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
