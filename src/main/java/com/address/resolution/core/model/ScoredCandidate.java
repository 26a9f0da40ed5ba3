package com.address.resolution.core.model;

import java.util.Objects;

/**
 * A candidate together with its similarity to the query it was fetched for.
 */
public record ScoredCandidate(Candidate candidate, SimilarityResult similarity) {
    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(similarity, "similarity is required");
    }

    public double score() {
        return similarity.score();
    }

    public int rank() {
        return candidate.rank();
    }
}
