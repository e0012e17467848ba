package com.nimbus.hmmselector.model;

/**
 * A trained probabilistic sequence model for one item at a fixed hidden state count.
 * Scoring observations against a model is the responsibility of a {@link ModelScorer}.
 */
public interface SequenceModel {

    /**
     * @return Number of hidden states this model was fitted with
     */
    public int numStates();

    /**
     * @return Dimension of the observation vectors this model accepts
     */
    public int featureDimension();

}
