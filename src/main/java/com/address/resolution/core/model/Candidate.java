package com.address.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One ranked suggestion returned by the lookup service for a query.
 *
 * @param rank           0-based position in the provider response
 * @param chineseFields  the Chinese premises address
 * @param englishFields  the English premises address
 * @param geo            geospatial payload, kept opaque
 * @param providerScore  validation score reported by the provider, or {@code null}
 */
public record Candidate(
        int rank,
        AddressNode.Group chineseFields,
        AddressNode.Group englishFields,
        JsonNode geo,
        Double providerScore
) {
    public Candidate {
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
        Objects.requireNonNull(chineseFields, "chineseFields is required");
        Objects.requireNonNull(englishFields, "englishFields is required");
    }
}
