package com.nimbus.hmmselector.selector;

/**
 * Chooses the best fitting model for one vocabulary item. Implementations search a range of
 * hidden state counts, score every candidate which fits, and return the single best one.
 * The set of criteria is closed, see {@link SelectorType}.
 */
public interface SelectionStrategy {

    /**
     * @param item Name of an item of the dataset this strategy was built with
     * @return The best model found, or an absent result if no candidate could be fitted and scored
     * @throws IllegalArgumentException if the item is not part of the dataset
     */
    public SelectionResult select(String item);

    public SelectorType type();

}
