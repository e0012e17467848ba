package com.nimbus.hmmselector.recognizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per test sequence scores and guesses, both index aligned with the recognized test list.
 */
public class RecognitionResult {

    private final List<Map<String, Double>> probabilities;
    private final List<String> guesses;

    public RecognitionResult(List<Map<String, Double>> probabilities, List<String> guesses) {
        if (probabilities == null || guesses == null || probabilities.size() != guesses.size())
            throw new IllegalArgumentException("Probabilities and guesses must be non null and equal in size");

        List<Map<String, Double>> frozen = new ArrayList<>(probabilities.size());
        for (Map<String, Double> scores : probabilities)
            frozen.add(Collections.unmodifiableMap(scores));

        this.probabilities = Collections.unmodifiableList(frozen);
        this.guesses = Collections.unmodifiableList(guesses);
    }

    /**
     * @return For each test sequence, item name to log likelihood in model order. Models
     * which could not score the sequence map to negative infinity.
     */
    public List<Map<String, Double>> getProbabilities() {
        return probabilities;
    }

    /**
     * @return For each test sequence, the best scoring item, or null when no model
     * produced a finite score
     */
    public List<String> getGuesses() {
        return guesses;
    }

    public int size() {
        return guesses.size();
    }

}
