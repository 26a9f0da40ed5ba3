package com.address.resolution.cli;

import com.address.resolution.api.AddressResolver;
import com.address.resolution.api.BatchResult;
import com.address.resolution.bulk.AddressCsvReader;
import com.address.resolution.bulk.OutputRecordCsvWriter;
import com.address.resolution.fetch.FetchOptions;
import com.address.resolution.fetch.LookupClient;
import com.address.resolution.fetch.OgcioLookupClient;
import com.address.resolution.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Batch entry point: reads addresses from CSV, resolves them against the OGCIO lookup
 * service and writes {@code scanned_addresses.csv}.
 *
 * <pre>
 * java -jar address-resolution.jar -ip addresses.csv -op out/ -lp logs/ --si 0 --ei 500
 * </pre>
 */
public final class AddressFetcherApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private AddressFetcherApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(CommandLineOptions.usage());
            return EXIT_USAGE;
        }

        // Must be set before the first logger is created; logback.xml reads it.
        System.setProperty("LOG_PATH", options.logPath());

        LookupClient client = OgcioLookupClient.builder()
                .baseUrl(options.baseUrl())
                .build();
        return run(options, client, out, err);
    }

    static int run(CommandLineOptions options, LookupClient client, PrintStream out, PrintStream err) {
        Logger log = LoggerFactory.getLogger(AddressFetcherApplication.class);

        List<String> addresses;
        try (Reader reader = Files.newBufferedReader(Path.of(options.inputPath()), StandardCharsets.UTF_8)) {
            addresses = new AddressCsvReader().read(reader, options.startIndex(), options.stopIndex());
        } catch (IOException | IllegalArgumentException e) {
            log.error("main.readFailed input={} error={}", options.inputPath(), e.getMessage(), e);
            err.println("Cannot read " + options.inputPath() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        out.println("Amount of addresses: " + addresses.size());

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AddressResolver resolver;
        try {
            resolver = AddressResolver.builder()
                    .lookupClient(client)
                    .rateLimit(options.rateLimit())
                    .fetchOptions(FetchOptions.builder()
                            .maxInFlight(options.maxInFlight())
                            .maxRetries(options.maxRetries())
                            .build())
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();
        } catch (IllegalArgumentException e) {
            log.error("main.invalidConfiguration error={}", e.getMessage());
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        long start = System.nanoTime();
        BatchResult result;
        try (resolver) {
            result = resolver.resolveBatch(addresses);
        }
        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        out.printf("Fetching from OGCIO endpoint takes: %.1f secs, of len=%d%n", elapsed, addresses.size());

        Path output = Path.of(options.outputFile());
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                new OutputRecordCsvWriter().write(writer, result.records());
            }
        } catch (IOException e) {
            log.error("main.writeFailed output={} error={}", output, e.getMessage(), e);
            err.println("Cannot write " + output + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        log.info("main.completed result={} output={} elapsedSecs={}", result, output, String.format("%.1f", elapsed));
        for (Meter meter : registry.getMeters()) {
            log.info("metric name={} tags={} values={}", meter.getId().getName(), meter.getId().getTags(), meter.measure());
        }
        return EXIT_OK;
    }
}
