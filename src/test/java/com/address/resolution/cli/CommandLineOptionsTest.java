package com.address.resolution.cli;

import com.address.resolution.fetch.OgcioLookupClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    @DisplayName("Short flags")
    void testShortFlags() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "-ip", "in.csv", "-op", "out/", "-lp", "logs/", "--si", "10", "--ei", "20"});

        assertEquals("in.csv", options.inputPath());
        assertEquals("out/scanned_addresses.csv", options.outputFile());
        assertEquals("logs/addresses_fetcher.log", options.logFile());
        assertEquals(10, options.startIndex());
        assertEquals(20, options.stopIndex());
    }

    @Test
    @DisplayName("Long flags and tuning options")
    void testLongFlags() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "--input_path", "in.csv", "--output_path", "run1_", "--log_path", "run1_",
                "--start_index", "0", "--stop_index", "5",
                "--rate_limit", "2.5", "--max_in_flight", "4", "--max_retries", "3",
                "--base_url", "http://localhost:8080/lookup"});

        assertEquals("run1_scanned_addresses.csv", options.outputFile());
        assertEquals(2.5, options.rateLimit());
        assertEquals(4, options.maxInFlight());
        assertEquals(3, options.maxRetries());
        assertEquals("http://localhost:8080/lookup", options.baseUrl());
    }

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"-ip", "in.csv"});

        assertEquals("scanned_addresses.csv", options.outputFile());
        assertEquals("addresses_fetcher.log", options.logFile());
        assertNull(options.startIndex());
        assertNull(options.stopIndex());
        assertEquals(20.0, options.rateLimit());
        assertEquals(20, options.maxInFlight());
        assertEquals(10, options.maxRetries());
        assertEquals(OgcioLookupClient.DEFAULT_BASE_URL, options.baseUrl());
    }

    @Test
    @DisplayName("Input path is required")
    void testMissingInput() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(new String[]{"-op", "out/"}));
    }

    @ParameterizedTest
    @ValueSource(strings = {"--si=abc", "--unknown", "--ei"})
    @DisplayName("Malformed arguments are rejected")
    void testMalformed(String flag) {
        String[] args = flag.equals("--ei")
                ? new String[]{"-ip", "in.csv", "--ei"}
                : new String[]{"-ip", "in.csv", flag, "x"};
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse(args));
    }

    @Test
    @DisplayName("Non-numeric index is rejected")
    void testBadNumber() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CommandLineOptions.parse(new String[]{"-ip", "in.csv", "--si", "ten"}));
        assertTrue(e.getMessage().contains("--si"));
    }
}
