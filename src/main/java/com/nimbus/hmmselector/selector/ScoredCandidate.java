package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.model.SequenceModel;

/**
 * A fitted candidate and its criterion score. Whether lower or higher is better depends on
 * the selector which produced it.
 * @param model The fitted model
 * @param numStates Hidden state count the model was fitted with
 * @param score Criterion score, NaN when the selector does not score candidates
 */
public record ScoredCandidate(SequenceModel model, int numStates, double score) {

    public ScoredCandidate {
        if (model == null)
            throw new IllegalArgumentException("Candidate model cannot be null");
    }

}
