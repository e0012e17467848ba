package com.nimbus.hmmselector.model;

import com.nimbus.hmmselector.data.ItemData;

/**
 * Computes the log probability of observations under a trained model
 */
public interface ModelScorer {

    /**
     * @param model A model previously produced by a compatible {@link ModelFitter}
     * @param data One or more sequences to score together
     * @return The total log likelihood of every sequence in data, or a failure if the model
     * cannot produce a finite likelihood for it. Never throws for well typed input.
     */
    public ScoreResult score(SequenceModel model, ItemData data);

}
