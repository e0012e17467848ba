package com.nimbus.hmmselector.model;

import com.nimbus.hmmselector.data.ItemData;

/**
 * Trains a sequence model with a requested number of hidden states. Implementations must
 * be deterministic for a fixed seed and safe to share between threads.
 */
public interface ModelFitter extends ModelScorer {

    /**
     * @param data Training sequences of one item
     * @param numStates Requested hidden state count
     * @return A fitted model, or a failure when the state count is incompatible with the data
     * or the optimization does not produce a valid probability model. Never throws for well
     * typed input.
     */
    public FitResult fit(ItemData data, int numStates);

}
