package com.nimbus.hmmselector.recognizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tallies guesses against the actual items of a test set, per item and overall
 */
public class RecognitionReporter {

    private final Map<String, WordReport> wordReports = new LinkedHashMap<>();
    private int total;
    private int correct;

    /**
     * Build a report for a whole recognition run
     * @param result Output of {@link Recognizer#recognize}
     * @param actual Actual item of every test sequence, index aligned with the result
     */
    public static RecognitionReporter of(RecognitionResult result, List<String> actual) {
        if (actual == null || actual.size() != result.size())
            throw new IllegalArgumentException("Expected " + result.size() + " actual items");

        RecognitionReporter reporter = new RecognitionReporter();
        for (int i = 0; i < actual.size(); i++)
            reporter.record(result.getGuesses().get(i), actual.get(i));

        return reporter;
    }

    /**
     * @param guessed Guessed item, null if no guess could be made
     * @param actual Actual item
     * @return true if the guess was correct
     */
    public boolean record(String guessed, String actual) {
        if (actual == null)
            throw new IllegalArgumentException("Actual item cannot be null");

        boolean match = guessed != null && Objects.equals(guessed, actual);
        wordReports.computeIfAbsent(actual, a -> new WordReport()).increment(match);

        total++;
        if (match)
            correct++;

        return match;
    }

    /**
     * @return Fraction of all recorded guesses which were correct
     */
    public float getAccuracy() {
        return total == 0 ? 0f : (float) correct / total;
    }

    /**
     * @return Word error rate, the fraction of recorded guesses which were wrong
     */
    public float getWordErrorRate() {
        return total == 0 ? 0f : 1f - getAccuracy();
    }

    public int getTotal() {
        return total;
    }

    public int getCorrect() {
        return correct;
    }

    /**
     * @return Actual item to its {@link WordReport}, in first seen order
     */
    public Map<String, WordReport> getWordReports() {
        return wordReports;
    }

}
