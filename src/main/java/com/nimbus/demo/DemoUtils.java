package com.nimbus.demo;

import com.nimbus.hmmselector.data.FeatureSequence;
import com.nimbus.hmmselector.selector.SelectorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class DemoUtils {

    public static final List<String> WORDS = List.of("JOHN", "MARY", "GO", "BOOK", "FISH");

    public static SelectorConfig loadDemoConfig() {
        try (InputStream inputStream = DemoUtils.class.getResourceAsStream("/demo-selector.json")) {
            if (inputStream == null)
                throw new RuntimeException("Cannot find demo-selector.json in resources folder");

            return SelectorConfig.load(inputStream);
        } catch (IOException e) {
            throw new RuntimeException("Error loading demo config: " + e.getMessage(), e);
        }
    }

    /**
     * Generate synthetic two dimensional "gesture" sequences. Every word moves through three
     * regimes of its own, each held for a random number of frames with gaussian jitter, so
     * a three state model describes each word well.
     */
    public static Map<String, List<FeatureSequence>> generateWords(List<String> words, int sequencesPerWord, long seed) {
        Random random = new Random(seed);
        Map<String, List<FeatureSequence>> data = new LinkedHashMap<>();

        for (int w = 0; w < words.size(); w++) {
            List<FeatureSequence> sequences = new ArrayList<>(sequencesPerWord);
            for (int s = 0; s < sequencesPerWord; s++)
                sequences.add(generateSequence(w, random));
            data.put(words.get(w), sequences);
        }

        return data;
    }

    public static FeatureSequence generateSequence(int wordIndex, Random random) {
        List<double[]> frames = new ArrayList<>();

        for (int regime = 0; regime < 3; regime++) {
            double x = wordIndex * 4.0 + regime * 1.5;
            double y = (regime - 1) * (wordIndex + 1.0);
            int hold = 5 + random.nextInt(4);

            for (int t = 0; t < hold; t++)
                frames.add(new double[]{x + random.nextGaussian() * 0.3, y + random.nextGaussian() * 0.3});
        }

        return new FeatureSequence(frames.toArray(new double[0][]));
    }

}
