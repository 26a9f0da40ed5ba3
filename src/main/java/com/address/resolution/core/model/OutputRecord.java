package com.address.resolution.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flat result for one successfully resolved address.
 *
 * @param inputAddress the original query, before normalization
 * @param score        the provider's validation score truncated to an integer
 * @param fields       value of every {@link OutputField}; missing entries read as empty
 * @param matchScore   similarity score of the selected candidate
 */
public record OutputRecord(
        String inputAddress,
        int score,
        Map<OutputField, String> fields,
        double matchScore
) {
    public static final String INPUT_ADDRESS_COLUMN = "input_address";
    public static final String SCORE_COLUMN = "score";
    public static final String MATCH_SCORE_COLUMN = "match_score";

    public OutputRecord {
        Objects.requireNonNull(inputAddress, "inputAddress is required");
        EnumMap<OutputField, String> copy = new EnumMap<>(OutputField.class);
        for (OutputField field : OutputField.values()) {
            String value = fields != null ? fields.get(field) : null;
            copy.put(field, value != null ? value : OutputField.DEFAULT_VALUE);
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public String get(OutputField field) {
        return fields.get(field);
    }

    /**
     * Column names in output order.
     */
    public static List<String> columns() {
        List<String> columns = new ArrayList<>();
        columns.add(INPUT_ADDRESS_COLUMN);
        columns.add(SCORE_COLUMN);
        for (OutputField field : OutputField.values()) {
            columns.add(field.column());
        }
        columns.add(MATCH_SCORE_COLUMN);
        return columns;
    }

    /**
     * Cell values aligned with {@link #columns()}.
     */
    public List<String> values() {
        List<String> values = new ArrayList<>();
        values.add(inputAddress);
        values.add(Integer.toString(score));
        for (OutputField field : OutputField.values()) {
            values.add(fields.get(field));
        }
        values.add(Double.toString(matchScore));
        return values;
    }
}
