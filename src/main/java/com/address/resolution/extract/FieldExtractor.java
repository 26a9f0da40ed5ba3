package com.address.resolution.extract;

import com.address.resolution.core.model.AddressNode;
import com.address.resolution.core.model.Candidate;
import com.address.resolution.core.model.Language;
import com.address.resolution.core.model.OutputField;
import com.address.resolution.core.model.OutputRecord;
import com.address.resolution.core.model.ScoredCandidate;

import java.util.EnumMap;
import java.util.Map;

/**
 * Projects the selected candidate onto the fixed {@link OutputField} schema.
 */
public class FieldExtractor {

    public OutputRecord extract(ScoredCandidate selected, String inputAddress) {
        Candidate candidate = selected.candidate();
        Map<OutputField, String> values = new EnumMap<>(OutputField.class);
        for (OutputField field : OutputField.values()) {
            AddressNode.Group source = field.language() == Language.CHINESE
                    ? candidate.chineseFields()
                    : candidate.englishFields();
            String value = source.find(field.path())
                    .filter(v -> !v.isEmpty())
                    .orElse(OutputField.DEFAULT_VALUE);
            values.put(field, value);
        }
        return new OutputRecord(inputAddress, providerScoreOf(candidate), values, selected.score());
    }

    static int providerScoreOf(Candidate candidate) {
        Double score = candidate.providerScore();
        if (score == null || score.isNaN() || score.isInfinite()) {
            return 0;
        }
        return (int) score.doubleValue();
    }
}
