package com.address.resolution.similarity;

import com.address.resolution.core.model.AddressNode;
import com.address.resolution.core.model.Candidate;
import com.address.resolution.core.model.FieldMatch;
import com.address.resolution.core.model.ScoredCandidate;
import com.address.resolution.core.model.SimilarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores candidate addresses against the query they were fetched for and picks the best.
 *
 * <p>Every candidate field found in the query earns {@code weight × goodness}; every field
 * that was not found costs one point whatever its weight. Only the Chinese premises address
 * is scored.</p>
 */
public class AddressScorer {
    private static final Logger log = LoggerFactory.getLogger(AddressScorer.class);

    private final AddressMatcher matcher;
    private final FieldWeights weights;

    public AddressScorer() {
        this(FieldWeights.ogcioDefaults());
    }

    public AddressScorer(FieldWeights weights) {
        this(new AddressMatcher(), weights);
    }

    public AddressScorer(AddressMatcher matcher, FieldWeights weights) {
        this.matcher = matcher;
        this.weights = weights;
    }

    /**
     * Computes the similarity between a query and one structured address.
     */
    public SimilarityResult similarity(String address, AddressNode.Group fields) {
        List<FieldMatch> matches = matcher.matchTree(address, fields);

        boolean[] coverage = new boolean[address.codePointCount(0, address.length())];
        double score = 0;

        for (FieldMatch match : matches) {
            if (!match.isMatched()) {
                score -= 1;
                continue;
            }
            score += weights.weightOf(match.fieldName()) * match.goodness();
            for (int i = match.span().start(); i < match.span().end(); i++) {
                coverage[i] = true;
            }
        }

        return new SimilarityResult(address, score, coverage, matches);
    }

    /**
     * Scores every candidate and returns them best first. The sort is stable, so among
     * equal scores the provider's order is kept.
     */
    public List<ScoredCandidate> rank(List<Candidate> candidates, String address) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            SimilarityResult similarity = similarity(address, candidate.chineseFields());
            log.debug("Similarity for '{}' vs candidate rank={}: score={}, match={}",
                    address, candidate.rank(), similarity.score(), similarity.coverageMask());
            scored.add(new ScoredCandidate(candidate, similarity));
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
        return scored;
    }

    /**
     * Returns the candidate with the highest score; the lowest rank wins a tie.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public ScoredCandidate selectBest(List<Candidate> candidates, String address) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to score for '" + address + "'");
        }
        return rank(candidates, address).get(0);
    }

    public FieldWeights getWeights() {
        return weights;
    }
}
