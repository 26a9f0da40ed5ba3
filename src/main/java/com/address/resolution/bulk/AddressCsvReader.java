package com.address.resolution.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the addresses to resolve from a CSV file.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * id,address
 * 1,香港中環皇后大道中99號
 * 2,"九龍彌敦道594號, 地下"
 * </pre>
 *
 * <p>The first record is a header and must contain an {@code address} column. A quoted field
 * may span lines. Rows can be sliced to {@code [start, stop)} before empty address cells are
 * skipped.</p>
 */
public class AddressCsvReader {
    private static final Logger log = LoggerFactory.getLogger(AddressCsvReader.class);

    public static final String ADDRESS_COLUMN = "address";

    private final String column;

    public AddressCsvReader() {
        this(ADDRESS_COLUMN);
    }

    public AddressCsvReader(String column) {
        this.column = column;
    }

    /**
     * Reads every address in the input.
     */
    public List<String> read(Reader reader) throws IOException {
        return read(reader, null, null);
    }

    /**
     * Reads the addresses of rows {@code [start, stop)}. The slice applies only when both
     * bounds are given.
     *
     * @throws IllegalArgumentException if the header has no address column or a bound is negative
     */
    public List<String> read(Reader reader, Integer start, Integer stop) throws IOException {
        if ((start != null && start < 0) || (stop != null && stop < 0)) {
            throw new IllegalArgumentException("start and stop must be >= 0");
        }

        List<String> cells = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = nextRecord(br);
            if (header == null) {
                return List.of();
            }
            int index = columnIndex(parseLine(stripBom(header)));

            String record;
            while ((record = nextRecord(br)) != null) {
                if (record.isEmpty()) {
                    continue;
                }
                List<String> fields = parseLine(record);
                cells.add(index < fields.size() ? fields.get(index) : "");
            }
        }

        List<String> rows = cells;
        if (start != null && stop != null) {
            int from = Math.min(start, cells.size());
            int to = Math.max(from, Math.min(stop, cells.size()));
            rows = cells.subList(from, to);
        }

        List<String> addresses = new ArrayList<>(rows.size());
        long skipped = 0;
        for (String cell : rows) {
            String value = cell.trim();
            if (value.isEmpty()) {
                skipped++;
                continue;
            }
            addresses.add(value);
        }
        log.info("csv.read rows={} addresses={} skipped={}", rows.size(), addresses.size(), skipped);
        return addresses;
    }

    private int columnIndex(List<String> header) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().equals(column)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Input has no '" + column + "' column: " + header);
    }

    /**
     * Reads one record, joining physical lines while a quoted field is still open.
     * Returns null at end of input.
     */
    static String nextRecord(BufferedReader br) throws IOException {
        String line = br.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder record = new StringBuilder(line);
        int quotes = countQuotes(line);
        while (quotes % 2 != 0) {
            String next = br.readLine();
            if (next == null) {
                log.warn("csv.unterminatedQuote record='{}'", record);
                break;
            }
            record.append('\n').append(next);
            quotes += countQuotes(next);
        }
        return record.toString();
    }

    private static int countQuotes(String line) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '"') {
                count++;
            }
        }
        return count;
    }

    /**
     * Splits one CSV record, honouring double-quoted fields and {@code ""} escapes.
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }
}
