package com.address.resolution.cli;

import com.address.resolution.fetch.OgcioLookupClient;

import java.util.Objects;

/**
 * Command line options of {@link AddressFetcherApplication}.
 *
 * @param inputPath   CSV file with an {@code address} column
 * @param outputPath  prefix of the output file; {@code scanned_addresses.csv} is appended
 * @param logPath     prefix of the log file; {@code addresses_fetcher.log} is appended
 * @param startIndex  first row to resolve, or {@code null}
 * @param stopIndex   row to stop before, or {@code null}
 * @param rateLimit   lookup requests per second
 * @param maxInFlight maximum concurrent lookups
 * @param maxRetries  attempts per address before giving up
 * @param baseUrl     lookup service endpoint
 */
public record CommandLineOptions(
        String inputPath,
        String outputPath,
        String logPath,
        Integer startIndex,
        Integer stopIndex,
        double rateLimit,
        int maxInFlight,
        int maxRetries,
        String baseUrl
) {
    public static final String OUTPUT_FILE = "scanned_addresses.csv";
    public static final String LOG_FILE = "addresses_fetcher.log";

    public CommandLineOptions {
        Objects.requireNonNull(inputPath, "--input_path is required");
        outputPath = outputPath != null ? outputPath : "";
        logPath = logPath != null ? logPath : "";
        baseUrl = baseUrl != null ? baseUrl : OgcioLookupClient.DEFAULT_BASE_URL;
    }

    public String outputFile() {
        return outputPath + OUTPUT_FILE;
    }

    public String logFile() {
        return logPath + LOG_FILE;
    }

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a malformed number
     */
    public static CommandLineOptions parse(String[] args) {
        String inputPath = null;
        String outputPath = null;
        String logPath = null;
        Integer startIndex = null;
        Integer stopIndex = null;
        double rateLimit = 20;
        int maxInFlight = 20;
        int maxRetries = 10;
        String baseUrl = null;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (flag.equals("-h") || flag.equals("--help")) {
                throw new IllegalArgumentException("help requested");
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "-ip", "--input_path" -> inputPath = value;
                case "-op", "--output_path" -> outputPath = value;
                case "-lp", "--log_path" -> logPath = value;
                case "--si", "--start_index" -> startIndex = parseInt(flag, value);
                case "--ei", "--stop_index" -> stopIndex = parseInt(flag, value);
                case "--rate_limit" -> rateLimit = parseDouble(flag, value);
                case "--max_in_flight" -> maxInFlight = parseInt(flag, value);
                case "--max_retries" -> maxRetries = parseInt(flag, value);
                case "--base_url" -> baseUrl = value;
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        if (inputPath == null) {
            throw new IllegalArgumentException("--input_path is required");
        }
        return new CommandLineOptions(inputPath, outputPath, logPath, startIndex, stopIndex,
                rateLimit, maxInFlight, maxRetries, baseUrl);
    }

    public static String usage() {
        return """
                Usage: address-fetcher -ip <input.csv> [options]
                  -ip, --input_path     CSV file with an 'address' column (required)
                  -op, --output_path    output prefix; writes <prefix>scanned_addresses.csv
                  -lp, --log_path       log prefix; writes <prefix>addresses_fetcher.log
                  --si, --start_index   first row to resolve
                  --ei, --stop_index    row to stop before
                  --rate_limit          lookup requests per second (default 20)
                  --max_in_flight       concurrent lookups (default 20)
                  --max_retries         attempts per address (default 10)
                  --base_url            lookup endpoint (default https://www.als.gov.hk/lookup)
                """;
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer, got '" + value + "'", e);
        }
    }

    private static double parseDouble(String flag, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got '" + value + "'", e);
        }
    }
}
