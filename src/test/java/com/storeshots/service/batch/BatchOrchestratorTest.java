package com.storeshots.service.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeshots.config.StoreShotsProperties.CompletenessProperties;
import com.storeshots.exception.CapabilityUnavailableException;
import com.storeshots.exception.ErrorKind;
import com.storeshots.exception.InvalidInvocationException;
import com.storeshots.service.catalog.DeviceCatalog;
import com.storeshots.service.catalog.DeviceCatalogLoader;
import com.storeshots.service.catalog.DeviceSpecAdapter;
import com.storeshots.service.catalog.Dimensions;
import com.storeshots.service.composition.CompositingEngine;
import com.storeshots.service.composition.CompositionOutcome;
import com.storeshots.service.composition.FrameOverlayComposer;
import com.storeshots.service.composition.GradientCanvasComposer;
import com.storeshots.service.composition.NormalizeComposer;
import com.storeshots.service.raster.RasterCapability;
import com.storeshots.service.raster.RasterInvoker;
import com.storeshots.service.validation.ImageValidator;
import com.storeshots.support.TestImages;
import com.storeshots.support.TestProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;

class BatchOrchestratorTest {

    @TempDir
    Path dir;

    private Path input;
    private Path output;
    private ImageValidator validator;
    private DeviceCatalog catalog;
    private RasterCapability capability;
    private ExecutorService rasterExecutor;
    private ExecutorService workers;
    private CompositingEngine engine;
    private BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        input = dir.resolve("screenshots");
        output = dir.resolve("processed");
        validator = new ImageValidator(TestProperties.validation());
        catalog = new DeviceCatalogLoader(new ObjectMapper(), new DeviceSpecAdapter(dir.resolve("frames"), ""))
                .loadCatalog(new ClassPathResource("catalogs/current-v2.json"));
        capability = mock(RasterCapability.class);
        rasterExecutor = Executors.newFixedThreadPool(2);
        workers = Executors.newFixedThreadPool(2);
        engine = new CompositingEngine(validator, new RasterInvoker(rasterExecutor, Duration.ofSeconds(60)),
                List.of(new GradientCanvasComposer(TestProperties.gradient()),
                        new FrameOverlayComposer(TestProperties.frame()),
                        new NormalizeComposer(TestProperties.frame())));
        orchestrator = orchestrator(engine, workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        rasterExecutor.shutdownNow();
    }

    @Test
    void strictRunPromotesWhenEveryFileSucceeds() {
        watchCapture("en-US/Watch-01.png", 1);
        watchCapture("fr-FR/Watch-01.png", 2);

        BatchReport report = orchestrator.run(request(PromotionMode.STRICT));

        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.promoted()).isTrue();
        assertThat(report.results()).extracting(ProcessingResult::output)
                .containsExactly(output.toAbsolutePath().resolve("en-US/Watch-01.png"),
                        output.toAbsolutePath().resolve("fr-FR/Watch-01.png"));
        assertThat(TestImages.read(output.resolve("en-US/Watch-01.png")).getWidth()).isEqualTo(396);
        assertThat(hiddenEntries()).isEmpty();
        verify(capability).probe();
    }

    @Test
    void bestEffortPromotesSuccessesAndReportsFailures() throws IOException {
        watchCapture("en-US/Watch-01.png", 3);
        corrupt("en-US/Watch-02.png");

        BatchReport report = orchestrator.run(request(PromotionMode.BEST_EFFORT));

        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.fileName()).isEqualTo("Watch-02.png");
            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INPUT_INVALID);
        });
        assertThat(report.promoted()).isTrue();
        assertThat(output.resolve("en-US/Watch-01.png")).isRegularFile();
        assertThat(output.resolve("en-US/Watch-02.png")).doesNotExist();
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void strictRunWithAFailureLeavesPreviousOutputUntouched() throws IOException {
        Path previous = output.resolve("en-US/Watch-01.png");
        Files.createDirectories(previous.getParent());
        Files.writeString(previous, "previous release");
        watchCapture("en-US/Watch-01.png", 4);
        corrupt("en-US/Watch-02.png");

        BatchReport report = orchestrator.run(request(PromotionMode.STRICT));

        assertThat(report.promoted()).isFalse();
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.results()).extracting(ProcessingResult::output).containsOnlyNulls();
        assertThat(previous).hasContent("previous release");
        try (Stream<Path> files = Files.list(output.resolve("en-US"))) {
            assertThat(files).containsExactly(previous);
        }
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void emptyLocaleProducesAnEmptyReport() throws IOException {
        Files.createDirectories(input.resolve("de-DE"));

        BatchReport report = orchestrator.run(request(PromotionMode.STRICT));

        assertThat(report.results()).isEmpty();
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.promoted()).isFalse();
        assertThat(output).doesNotExist();
    }

    @Test
    void missingCapabilityFailsBeforeAnythingIsWritten() {
        watchCapture("en-US/Watch-01.png", 5);
        doThrow(new CapabilityUnavailableException("opencv_core could not be loaded")).when(capability).probe();

        assertThatThrownBy(() -> orchestrator.run(request(PromotionMode.STRICT)))
                .isInstanceOf(CapabilityUnavailableException.class);
        assertThat(output).doesNotExist();
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void capabilityLostMidRunAbortsAndCancelsTheRest() {
        watchCapture("en-US/Watch-01.png", 6);
        watchCapture("en-US/Watch-02.png", 7);
        watchCapture("fr-FR/Watch-01.png", 8);
        CompositingEngine broken = mock(CompositingEngine.class);
        when(broken.compose(any(), any(), any())).thenThrow(new CapabilityUnavailableException("library unloaded"));
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            BatchReport report = orchestrator(broken, single).run(request(PromotionMode.BEST_EFFORT));

            assertThat(report.aborted()).isTrue();
            assertThat(report.promoted()).isFalse();
            assertThat(report.failed()).isEqualTo(3);
            assertThat(report.results()).extracting(ProcessingResult::errorKind)
                    .containsOnly(ErrorKind.TOOL_UNAVAILABLE, ErrorKind.CANCELLED)
                    .contains(ErrorKind.TOOL_UNAVAILABLE);
            assertThat(output).doesNotExist();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void dryRunWritesNothingAndSkipsTheProbe() throws IOException {
        watchCapture("en-US/Watch-01.png", 9);
        corrupt("en-US/junk.png");

        BatchReport report = new BatchOrchestrator(discovery(), new DeviceResolver(catalog, validator, "desktop"),
                engine, capability, CompletenessCheck.disabled(), workers)
                .run(new BatchRequest(input, output, true, PromotionMode.STRICT, null));

        assertThat(report.dryRun()).isTrue();
        assertThat(report.results()).extracting(ProcessingResult::status).containsOnly(ProcessingStatus.SKIPPED);
        assertThat(report.results()).extracting(ProcessingResult::message)
                .anySatisfy(message -> assertThat(message).isEqualTo("dry run: would compose for watch"))
                .anySatisfy(message -> assertThat(message).startsWith("dry run: would fail [INPUT_INVALID]"));
        assertThat(output).doesNotExist();
        assertThat(hiddenEntries()).isEmpty();
        verify(capability, never()).probe();
    }

    @Test
    void filesWithoutAMatchingDeviceAreSkippedWithoutBlockingPromotion() {
        watchCapture("en-US/Watch-01.png", 10);
        TestImages.blocks(input.resolve("en-US/window.png"), 800, 652, 11);

        BatchReport report = orchestrator.run(request(PromotionMode.STRICT));

        assertThat(report.skipped()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.promoted()).isTrue();
        assertThat(output.resolve("en-US/window.png")).doesNotExist();
    }

    @Test
    void rerunProducesIdenticalOutput() throws IOException {
        watchCapture("en-US/Watch-01.png", 12);
        orchestrator.run(request(PromotionMode.STRICT));
        byte[] first = Files.readAllBytes(output.resolve("en-US/Watch-01.png"));

        BatchReport second = orchestrator.run(request(PromotionMode.STRICT));

        assertThat(second.promoted()).isTrue();
        assertThat(Files.readAllBytes(output.resolve("en-US/Watch-01.png"))).isEqualTo(first);
    }

    @Test
    void cancellingALocaleReportsItsFilesAsCancelled() {
        watchCapture("en-US/Watch-01.png", 13);
        watchCapture("en-US/Watch-02.png", 14);
        watchCapture("fr-FR/Watch-01.png", 15);
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            single.submit(() -> {
                release.await();
                return null;
            });
            BatchExecution execution = orchestrator(engine, single)
                    .submit(request(PromotionMode.BEST_EFFORT));

            assertThat(execution.cancelLocale("en-US")).isTrue();
            assertThat(execution.cancelLocale("xx-XX")).isFalse();
            release.countDown();
            BatchReport report = execution.awaitReport();

            assertThat(report.results()).filteredOn(result -> result.locale().equals("en-US"))
                    .extracting(ProcessingResult::errorKind)
                    .containsExactly(ErrorKind.CANCELLED, ErrorKind.CANCELLED);
            assertThat(report.succeeded()).isEqualTo(1);
            assertThat(output.resolve("fr-FR/Watch-01.png")).isRegularFile();
            assertThat(output.resolve("en-US")).doesNotExist();
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }

    @Test
    void cancellingALocaleLetsTheFileInFlightFinish() throws Exception {
        watchCapture("en-US/Watch-01.png", 17);
        watchCapture("en-US/Watch-02.png", 18);
        watchCapture("fr-FR/Watch-01.png", 19);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompositingEngine slow = mock(CompositingEngine.class);
        when(slow.compose(any(), any(), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await();
            Path staged = invocation.getArgument(1);
            Files.createDirectories(staged.getParent());
            Files.writeString(staged, "composed");
            return new CompositionOutcome("watch", staged, new Dimensions(416, 496), new Dimensions(396, 484),
                    Files.size(staged), List.of());
        });
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            BatchExecution execution = orchestrator(slow, single).submit(request(PromotionMode.BEST_EFFORT));
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

            execution.cancelLocale("en-US");
            CompletableFuture<BatchReport> pending = CompletableFuture.supplyAsync(execution::awaitReport);
            Thread.sleep(200);
            assertThat(pending).isNotDone();
            release.countDown();
            BatchReport report = pending.get(10, TimeUnit.SECONDS);

            assertThat(report.results()).filteredOn(result -> result.locale().equals("en-US"))
                    .extracting(ProcessingResult::fileName, ProcessingResult::status)
                    .containsExactly(tuple("Watch-01.png", ProcessingStatus.SUCCEEDED),
                            tuple("Watch-02.png", ProcessingStatus.FAILED));
            assertThat(report.succeeded()).isEqualTo(2);
            assertThat(output.resolve("en-US/Watch-01.png")).hasContent("composed");
            assertThat(output.resolve("fr-FR/Watch-01.png")).isRegularFile();
            assertThat(hiddenEntries()).isEmpty();
        } finally {
            release.countDown();
            single.shutdownNow();
        }
    }

    @Test
    void enforcedCompletenessGapBlocksStrictPromotion() {
        watchCapture("en-US/Watch-01.png", 20);
        watchCapture("en-US/Watch-02.png", 21);
        watchCapture("fr-FR/Watch-01.png", 22);
        CompletenessCheck completeness = new CompletenessCheck(catalog,
                new CompletenessProperties(Map.of("Watch", 2), true));

        BatchReport report = orchestrator(engine, workers, completeness).run(request(PromotionMode.STRICT));

        assertThat(report.failed()).isZero();
        assertThat(report.incomplete()).containsExactly(new CompletenessGap("fr-FR", "watch", 2, 1));
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.promoted()).isFalse();
        assertThat(output).doesNotExist();
        assertThat(hiddenEntries()).isEmpty();
    }

    @Test
    void unenforcedCompletenessGapIsOnlyReported() {
        watchCapture("en-US/Watch-01.png", 23);
        CompletenessCheck completeness = new CompletenessCheck(catalog,
                new CompletenessProperties(Map.of("watch", 2), false));

        BatchReport report = orchestrator(engine, workers, completeness).run(request(PromotionMode.STRICT));

        assertThat(report.incomplete()).singleElement().extracting(CompletenessGap::actual).isEqualTo(1);
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.promoted()).isTrue();
    }

    @Test
    void unknownForcedDeviceIsAnInvocationError() {
        watchCapture("en-US/Watch-01.png", 16);

        assertThatThrownBy(() -> orchestrator.run(new BatchRequest(input, output, false, PromotionMode.STRICT,
                "tablet")))
                .isInstanceOf(InvalidInvocationException.class)
                .hasMessageContaining("tablet");
        verify(capability, never()).probe();
    }

    @Test
    void missingInputDirectoryIsAnInvocationError() {
        assertThatThrownBy(() -> orchestrator.run(request(PromotionMode.STRICT)))
                .isInstanceOf(InvalidInvocationException.class);
        assertThat(output).doesNotExist();
    }

    private BatchOrchestrator orchestrator(CompositingEngine compositingEngine, ExecutorService pool) {
        return orchestrator(compositingEngine, pool, CompletenessCheck.disabled());
    }

    private BatchOrchestrator orchestrator(CompositingEngine compositingEngine, ExecutorService pool,
            CompletenessCheck completeness) {
        return new BatchOrchestrator(discovery(), new DeviceResolver(catalog, validator, ""), compositingEngine,
                capability, completeness, pool);
    }

    private LocaleDiscovery discovery() {
        return new LocaleDiscovery(TestProperties.batch(PromotionMode.STRICT));
    }

    private BatchRequest request(PromotionMode mode) {
        return new BatchRequest(input, output, false, mode, null);
    }

    private void watchCapture(String relative, long seed) {
        TestImages.blocks(input.resolve(relative), 416, 496, seed);
    }

    private void corrupt(String relative) throws IOException {
        Path file = input.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "truncated");
    }

    private List<String> hiddenEntries() {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.map(path -> path.getFileName().toString()).filter(name -> name.startsWith(".")).toList();
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
