package com.address.resolution.similarity;

import java.util.Map;

/**
 * Points awarded per provider field when it is found in the query.
 * Fields not listed weigh nothing, but still cost a point when unmatched.
 */
public record FieldWeights(Map<String, Double> weights) {

    public FieldWeights {
        weights = weights != null ? Map.copyOf(weights) : Map.of();
    }

    /**
     * Weights for matching a query against an OGCIO Chinese premises address.
     */
    public static FieldWeights ogcioDefaults() {
        return new FieldWeights(Map.of(
                "Region", 10.0,
                "StreetName", 20.0,
                "VillageName", 20.0,
                "EstateName", 20.0,
                "BuildingNoFrom", 30.0,
                "BuildingNoTo", 30.0,
                "BuildingName", 40.0
        ));
    }

    public double weightOf(String fieldName) {
        return weights.getOrDefault(fieldName, 0.0);
    }
}
