package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.model.SequenceModel;

import java.util.Optional;

/**
 * The model chosen for one item by one selector, or an explicit absence when every
 * candidate failed. Absent items cannot be recognized and are left out of trained model sets.
 */
public class SelectionResult {

    private final String item;
    private final SelectorType selector;
    private final ScoredCandidate candidate;

    private SelectionResult(String item, SelectorType selector, ScoredCandidate candidate) {
        if (item == null || selector == null)
            throw new IllegalArgumentException("Item and selector cannot be null");

        this.item = item;
        this.selector = selector;
        this.candidate = candidate;
    }

    public static SelectionResult of(String item, SelectorType selector, ScoredCandidate candidate) {
        if (candidate == null)
            throw new IllegalArgumentException("Candidate cannot be null, use absent()");

        return new SelectionResult(item, selector, candidate);
    }

    public static SelectionResult absent(String item, SelectorType selector) {
        return new SelectionResult(item, selector, null);
    }

    public String getItem() {
        return item;
    }

    public SelectorType getSelector() {
        return selector;
    }

    public boolean isPresent() {
        return candidate != null;
    }

    public Optional<ScoredCandidate> getCandidate() {
        return Optional.ofNullable(candidate);
    }

    public Optional<SequenceModel> getModel() {
        return getCandidate().map(ScoredCandidate::model);
    }

    /**
     * @return Chosen hidden state count, or 0 when absent
     */
    public int getNumStates() {
        return candidate != null ? candidate.numStates() : 0;
    }

    /**
     * @return Criterion score of the chosen candidate, NaN when absent or unscored
     */
    public double getScore() {
        return candidate != null ? candidate.score() : Double.NaN;
    }

    @Override
    public String toString() {
        return candidate == null
                ? item + " (" + selector + "): no model"
                : item + " (" + selector + "): " + candidate.numStates() + " states, score " + candidate.score();
    }

}
