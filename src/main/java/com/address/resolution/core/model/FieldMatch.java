package com.address.resolution.core.model;

import java.util.Objects;

/**
 * Result of testing one candidate field against a query.
 *
 * @param fieldName  provider key of the field, e.g. {@code BuildingName}
 * @param fieldValue the candidate value that was searched for
 * @param span       where the value was found in the query, or {@code null} if not found
 * @param goodness   match quality in {@code [-1, 1]}, or {@code null} if not computed
 */
public record FieldMatch(
        String fieldName,
        String fieldValue,
        MatchSpan span,
        Double goodness
) {
    public FieldMatch {
        Objects.requireNonNull(fieldName, "fieldName is required");
    }

    public static FieldMatch unmatched(String fieldName, String fieldValue) {
        return new FieldMatch(fieldName, fieldValue, null, null);
    }

    public boolean isMatched() {
        return span != null;
    }

    @Override
    public String toString() {
        return "(" + fieldName + ", " + fieldValue + ", " + span + ", " + goodness + ")";
    }
}
