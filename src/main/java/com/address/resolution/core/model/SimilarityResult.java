package com.address.resolution.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of all field matches of one candidate against one query.
 * The coverage mask has one entry per code point of the query.
 */
public record SimilarityResult(
        String query,
        double score,
        boolean[] coverage,
        List<FieldMatch> matches
) {
    public SimilarityResult {
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(coverage, "coverage is required");
        if (coverage.length != query.codePointCount(0, query.length())) {
            throw new IllegalArgumentException("coverage must have one entry per code point of the query");
        }
        coverage = coverage.clone();
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    @Override
    public boolean[] coverage() {
        return coverage.clone();
    }

    /**
     * Number of query code points claimed by at least one matched field.
     */
    public int coveredCount() {
        int count = 0;
        for (boolean covered : coverage) {
            if (covered) count++;
        }
        return count;
    }

    /**
     * The query with every code point that no field claimed replaced by {@code ?}.
     */
    public String coverageMask() {
        StringBuilder sb = new StringBuilder(query.length());
        int[] codePoints = query.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            if (coverage[i]) {
                sb.appendCodePoint(codePoints[i]);
            } else {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimilarityResult that)) return false;
        return Double.compare(score, that.score) == 0
                && query.equals(that.query)
                && Arrays.equals(coverage, that.coverage)
                && matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, score, Arrays.hashCode(coverage), matches);
    }

    @Override
    public String toString() {
        return "query: " + query + "\n" +
                "match: " + coverageMask() + "\n" +
                "matches: " + matches + "\n" +
                "score: " + score + "\n";
    }
}
