package com.nimbus.hmmselector.recognizer;

/**
 * Recognition tally for the test sequences of one actual item
 */
public class WordReport {

    private int samples;
    private int correct;

    void increment(boolean correct) {
        samples++;

        if (correct)
            this.correct++;
    }

    /**
     * @return Number of test sequences whose actual item is this one
     */
    public int getSamples() {
        return samples;
    }

    /**
     * @return Number of those sequences guessed correctly
     */
    public int getCorrect() {
        return correct;
    }

    /**
     * @return Fraction of this item's sequences guessed correctly
     */
    public float calcAccuracy() {
        if (samples == 0)
            return 0;

        return (float) correct / samples;
    }

}
