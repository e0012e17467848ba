package com.nimbus.hmmselector.recognizer;

import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.ModelScorer;
import com.nimbus.hmmselector.model.ScoreResult;
import com.nimbus.hmmselector.model.SequenceModel;
import com.nimbus.hmmselector.selector.TrainedModels;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guesses the item of unseen sequences by scoring each one against every trained model and
 * taking the highest log likelihood. A model which fails to score a sequence is recorded at
 * negative infinity and can never win. Among equal scores the model first in iteration
 * order wins.
 */
public class Recognizer {

    private static final Logger LOG = LogManager.getLogger(Recognizer.class);

    private final ModelScorer scorer;

    public Recognizer(ModelScorer scorer) {
        if (scorer == null)
            throw new IllegalArgumentException("Scorer cannot be null");

        this.scorer = scorer;
    }

    public RecognitionResult recognize(TrainedModels models, List<ItemData> testSequences) {
        return recognize(models.getModels(), testSequences);
    }

    /**
     * @param models Item to trained model. Iteration order decides ties and the key order of
     *               every returned score map.
     * @param testSequences Sequences to classify, each scored independently
     * @return Scores and guesses in test sequence order
     */
    public RecognitionResult recognize(Map<String, ? extends SequenceModel> models, List<ItemData> testSequences) {
        if (models == null || testSequences == null)
            throw new IllegalArgumentException("Models and test sequences cannot be null");

        List<Map<String, Double>> probabilities = new ArrayList<>(testSequences.size());
        List<String> guesses = new ArrayList<>(testSequences.size());

        for (ItemData sequence : testSequences) {
            Map<String, Double> scores = scoreAll(models, sequence);
            probabilities.add(scores);
            guesses.add(bestGuess(scores));
        }

        return new RecognitionResult(probabilities, guesses);
    }

    /**
     * @return Item to log likelihood of one test sequence, in model order
     */
    public Map<String, Double> scoreAll(Map<String, ? extends SequenceModel> models, ItemData sequence) {
        Map<String, Double> scores = new LinkedHashMap<>();

        models.forEach((item, model) -> {
            ScoreResult result = scorer.score(model, sequence);
            if (result.isSuccess()) {
                scores.put(item, result.logLikelihood());
            } else {
                LOG.debug("Model {} could not score sequence: {}", item, result.failure());
                scores.put(item, Double.NEGATIVE_INFINITY);
            }
        });

        return scores;
    }

    /**
     * @return The first item holding the highest finite score, or null if there is none
     */
    static String bestGuess(Map<String, Double> scores) {
        String guess = null;
        double best = Double.NEGATIVE_INFINITY;

        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                guess = entry.getKey();
            }
        }

        return guess;
    }

}
