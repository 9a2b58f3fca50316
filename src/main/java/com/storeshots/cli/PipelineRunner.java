package com.storeshots.cli;

import com.storeshots.config.StoreShotsProperties;
import com.storeshots.exception.CapabilityUnavailableException;
import com.storeshots.exception.InvalidInvocationException;
import com.storeshots.service.batch.BatchOrchestrator;
import com.storeshots.service.batch.BatchReport;
import com.storeshots.service.batch.BatchRequest;
import com.storeshots.service.batch.CompletenessGap;
import com.storeshots.service.batch.ProcessingResult;
import com.storeshots.service.batch.PromotionMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Command line entry point. Never throws: every outcome is logged and mapped to an exit code.
 */
@Component
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_INVALID_INVOCATION = 1;
    static final int EXIT_CAPABILITY_UNAVAILABLE = 2;
    static final int EXIT_PROCESSING_FAILURE = 3;

    private static final String USAGE = """
            Usage: store-shots --input=<dir> [options]

              --input=<dir>      root containing one subdirectory per locale (required)
              --output=<dir>     canonical output root (default: <input>/%s)
              --mode=<mode>      strict | best-effort (default: %s)
              --device=<id>      force one catalog device for every screenshot
              --dry-run          resolve devices and report the plan without writing
              --verbose          debug logging
              --help             print this message
            """;

    private final BatchOrchestrator orchestrator;
    private final StoreShotsProperties properties;

    private volatile int exitCode = EXIT_SUCCESS;

    public PipelineRunner(BatchOrchestrator orchestrator, StoreShotsProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        if (args.containsOption("help")) {
            System.out.printf(USAGE, properties.batch().defaultOutputName(),
                    properties.batch().mode().name().toLowerCase(Locale.ROOT).replace('_', '-'));
            return EXIT_SUCCESS;
        }
        if (args.containsOption("verbose")) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel("com.storeshots", LogLevel.DEBUG);
        }
        try {
            BatchRequest request = toRequest(args);
            BatchReport report = orchestrator.run(request);
            summarize(report);
            return exitCodeFor(report);
        } catch (InvalidInvocationException ex) {
            log.error("{}", ex.getMessage());
            return EXIT_INVALID_INVOCATION;
        } catch (CapabilityUnavailableException ex) {
            log.error("Raster capability unavailable, nothing was written: {}", ex.getMessage());
            return EXIT_CAPABILITY_UNAVAILABLE;
        } catch (RuntimeException ex) {
            log.error("Run failed unexpectedly", ex);
            return EXIT_PROCESSING_FAILURE;
        }
    }

    BatchRequest toRequest(ApplicationArguments args) {
        String input = single(args, "input");
        if (input == null) {
            throw new InvalidInvocationException("Missing required --input=<dir>; see --help");
        }
        Path inputRoot = Path.of(input);
        String output = single(args, "output");
        Path outputRoot = output == null ? inputRoot.resolve(properties.batch().defaultOutputName()) : Path.of(output);

        PromotionMode mode = properties.batch().mode() == null ? PromotionMode.STRICT : properties.batch().mode();
        String requestedMode = single(args, "mode");
        if (requestedMode != null) {
            try {
                mode = PromotionMode.parse(requestedMode);
            } catch (IllegalArgumentException ex) {
                throw new InvalidInvocationException(ex.getMessage());
            }
        }
        return new BatchRequest(inputRoot, outputRoot, args.containsOption("dry-run"), mode, single(args, "device"));
    }

    static int exitCodeFor(BatchReport report) {
        if (report.aborted()) {
            return EXIT_CAPABILITY_UNAVAILABLE;
        }
        if (report.hasFailures()) {
            return EXIT_PROCESSING_FAILURE;
        }
        return EXIT_SUCCESS;
    }

    private void summarize(BatchReport report) {
        log.info("Run {} finished in {} ms: {} succeeded, {} failed, {} skipped{}",
                report.runId(), report.elapsed().toMillis(), report.succeeded(), report.failed(), report.skipped(),
                report.dryRun() ? " (dry run, nothing written)" : "");
        for (ProcessingResult failure : report.failures()) {
            log.error("FAILED {}/{} [{}] {}", failure.locale(), failure.fileName(), failure.errorKind(),
                    failure.message());
        }
        for (CompletenessGap gap : report.incomplete()) {
            if (report.completenessEnforced()) {
                log.error("INCOMPLETE {} {}: {} of {} expected asset(s)", gap.locale(), gap.deviceId(), gap.actual(),
                        gap.expected());
            } else {
                log.warn("INCOMPLETE {} {}: {} of {} expected asset(s)", gap.locale(), gap.deviceId(), gap.actual(),
                        gap.expected());
            }
        }
        if (report.promotionError() != null) {
            log.error("{}", report.promotionError());
        } else if (!report.dryRun() && report.succeeded() > 0) {
            log.info(report.promoted() ? "Output promoted ({})" : "Output not promoted ({})",
                    report.mode().name().toLowerCase(Locale.ROOT).replace('_', '-'));
        }
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return null;
        }
        if (values.size() != 1 || values.get(0).isBlank()) {
            throw new InvalidInvocationException("--" + name + " requires exactly one value");
        }
        return values.get(0).trim();
    }
}
