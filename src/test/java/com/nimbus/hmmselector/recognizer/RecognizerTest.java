package com.nimbus.hmmselector.recognizer;

import com.nimbus.hmmselector.data.FeatureSequence;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.ModelScorer;
import com.nimbus.hmmselector.model.ScoreResult;
import com.nimbus.hmmselector.model.SequenceModel;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognizerTest {

    /**
     * Model whose score on the n-th test sequence is looked up by the scorer
     */
    private record FixedModel(String name) implements SequenceModel {
        @Override
        public int numStates() {
            return 1;
        }

        @Override
        public int featureDimension() {
            return 1;
        }
    }

    private static final ItemData FIRST = ItemData.of(FeatureSequence.of(new double[]{1}));
    private static final ItemData SECOND = ItemData.of(FeatureSequence.of(new double[]{2}));

    private final Map<String, ScoreResult> scores = new HashMap<>();

    private final ModelScorer scorer = (model, data) -> {
        ScoreResult result = scores.get(((FixedModel) model).name() + (data == FIRST ? "1" : "2"));
        return result != null ? result : ScoreResult.failure("not scripted");
    };

    private static Map<String, SequenceModel> models(String... names) {
        Map<String, SequenceModel> models = new LinkedHashMap<>();
        for (String name : names)
            models.put(name, new FixedModel(name));
        return models;
    }

    @Test
    void shouldGuessHighestLikelihood() {
        scores.put("A1", ScoreResult.success(-50));
        scores.put("B1", ScoreResult.success(-30));
        scores.put("C1", ScoreResult.success(-75));

        RecognitionResult result = new Recognizer(scorer).recognize(models("A", "B", "C"), List.of(FIRST));

        assertThat(result.getGuesses()).containsExactly("B");
        assertThat(result.getProbabilities().get(0)).containsExactly(
                Map.entry("A", -50.0), Map.entry("B", -30.0), Map.entry("C", -75.0));
    }

    @Test
    void shouldRecordFailedScoresAsNegativeInfinity() {
        scores.put("A1", ScoreResult.success(-50));
        scores.put("B1", ScoreResult.failure("dimension mismatch"));

        RecognitionResult result = new Recognizer(scorer).recognize(models("A", "B"), List.of(FIRST));

        assertThat(result.getProbabilities().get(0)).containsEntry("B", Double.NEGATIVE_INFINITY);
        assertThat(result.getGuesses()).containsExactly("A");
    }

    @Test
    void shouldGuessNullWhenNoModelScores() {
        RecognitionResult result = new Recognizer(scorer).recognize(models("A", "B"), List.of(FIRST));

        assertThat(result.getGuesses()).containsExactly((String) null);
        assertThat(result.getProbabilities().get(0).values()).containsOnly(Double.NEGATIVE_INFINITY);
    }

    @Test
    void shouldGuessNullWithoutModels() {
        RecognitionResult result = new Recognizer(scorer).recognize(models(), List.of(FIRST, SECOND));

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.getGuesses()).containsExactly(null, null);
        assertThat(result.getProbabilities()).allSatisfy(p -> assertThat(p).isEmpty());
    }

    @Test
    void shouldKeepTestSequenceOrder() {
        scores.put("A1", ScoreResult.success(-1));
        scores.put("B1", ScoreResult.success(-9));
        scores.put("A2", ScoreResult.success(-9));
        scores.put("B2", ScoreResult.success(-1));

        RecognitionResult result = new Recognizer(scorer).recognize(models("A", "B"), List.of(SECOND, FIRST, SECOND));

        assertThat(result.getGuesses()).containsExactly("B", "A", "B");
    }

    @Test
    void shouldNotExposeMutableScores() {
        scores.put("A1", ScoreResult.success(-1));

        RecognitionResult result = new Recognizer(scorer).recognize(models("A"), List.of(FIRST));

        assertThatThrownBy(() -> result.getProbabilities().get(0).put("B", 0.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getGuesses().set(0, "B"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldPreferFirstModelOnTie() {
        Map<String, Double> tied = new LinkedHashMap<>();
        tied.put("X", -5.0);
        tied.put("Y", -5.0);

        assertThat(Recognizer.bestGuess(tied)).isEqualTo("X");
    }

    @Test
    void shouldRejectMissingInputs() {
        assertThatThrownBy(() -> new Recognizer(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Recognizer(scorer).recognize(models("A"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
