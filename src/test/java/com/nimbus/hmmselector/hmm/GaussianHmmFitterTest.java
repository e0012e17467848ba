package com.nimbus.hmmselector.hmm;

import com.nimbus.hmmselector.data.FeatureSequence;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ScoreResult;
import com.nimbus.hmmselector.model.SequenceModel;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GaussianHmmFitterTest {

    private final GaussianHmmFitter fitter = new GaussianHmmFitter(14);

    /**
     * Sequences that sit near 0 for ten frames and then near 10 for ten frames
     */
    private static ItemData twoRegimes(long seed, int sequences) {
        Random random = new Random(seed);
        List<FeatureSequence> list = new ArrayList<>();
        for (int s = 0; s < sequences; s++) {
            double[][] frames = new double[20][1];
            for (int t = 0; t < 20; t++)
                frames[t][0] = (t < 10 ? 0 : 10) + random.nextGaussian() * 0.5;
            list.add(new FeatureSequence(frames));
        }
        return ItemData.of(list);
    }

    @Test
    void shouldRecoverSeparatedRegimes() {
        FitResult result = fitter.fit(twoRegimes(3, 3), 2);

        assertThat(result.isSuccess()).isTrue();
        GaussianHmm model = (GaussianHmm) result.model();

        double[] means = {model.getMeans()[0][0], model.getMeans()[1][0]};
        Arrays.sort(means);
        assertThat(means[0]).isCloseTo(0, within(0.5));
        assertThat(means[1]).isCloseTo(10, within(0.5));

        int low = model.getMeans()[0][0] < model.getMeans()[1][0] ? 0 : 1;
        assertThat(model.getStartProb()[low]).isCloseTo(1, within(1e-3));
        assertThat(model.getTransMat()[1 - low][1 - low]).isCloseTo(1, within(1e-3));
    }

    @Test
    void shouldProduceStochasticParameters() {
        GaussianHmm model = (GaussianHmm) fitter.fit(twoRegimes(5, 4), 2).model();

        assertThat(Arrays.stream(model.getStartProb()).sum()).isCloseTo(1, within(1e-9));
        for (double[] row : model.getTransMat())
            assertThat(Arrays.stream(row).sum()).isCloseTo(1, within(1e-9));
        for (double[] covar : model.getCovars())
            assertThat(covar[0]).isGreaterThanOrEqualTo(GaussianHmmFitter.DEFAULT_MIN_COVAR);
    }

    @Test
    void shouldFitIdenticallyWithSameSeed() {
        ItemData data = twoRegimes(7, 3);

        FitResult first = new GaussianHmmFitter(42).fit(data, 3);
        FitResult second = new GaussianHmmFitter(42).fit(data, 3);

        assertThat(first.model()).isEqualTo(second.model());
        assertThat(fitter.score(first.model(), data).logLikelihood())
                .isEqualTo(fitter.score(second.model(), data).logLikelihood());
    }

    @Test
    void shouldFitSingleStateToDataMoments() {
        ItemData data = twoRegimes(9, 2);
        double[] column = Arrays.stream(data.getFeatures()).mapToDouble(frame -> frame[0]).toArray();

        GaussianHmm model = (GaussianHmm) fitter.fit(data, 1).model();

        assertThat(model.getMeans()[0][0]).isCloseTo(StatUtils.mean(column), within(1e-6));
        assertThat(model.getCovars()[0][0])
                .isCloseTo(StatUtils.populationVariance(column) + GaussianHmmFitter.DEFAULT_MIN_COVAR, within(1e-6));
    }

    @Test
    void shouldScoreMoreStatesHigherOnRegimeData() {
        ItemData data = twoRegimes(11, 3);

        ScoreResult one = fitter.score(fitter.fit(data, 1).model(), data);
        ScoreResult two = fitter.score(fitter.fit(data, 2).model(), data);

        assertThat(two.logLikelihood()).isGreaterThan(one.logLikelihood());
    }

    @Test
    void shouldFailWithMoreStatesThanObservations() {
        ItemData data = ItemData.of(FeatureSequence.of(new double[]{1}, new double[]{2}, new double[]{3}));

        FitResult result = fitter.fit(data, 4);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).contains("4 states");
    }

    @Test
    void shouldFailWithoutStates() {
        assertThat(fitter.fit(twoRegimes(1, 1), 0).isSuccess()).isFalse();
    }

    @Test
    void shouldFailWhenNoTransitionsAreObserved() {
        ItemData singleFrames = ItemData.of(
                FeatureSequence.of(new double[]{0}), FeatureSequence.of(new double[]{1}),
                FeatureSequence.of(new double[]{2}), FeatureSequence.of(new double[]{10}),
                FeatureSequence.of(new double[]{11}));

        FitResult result = fitter.fit(singleFrames, 2);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).contains("collapsed");
    }

    @Test
    void shouldFailOnIdenticalObservations() {
        double[][] frames = new double[6][];
        Arrays.fill(frames, new double[]{4, 4});

        assertThat(fitter.fit(ItemData.of(new FeatureSequence(frames)), 2).isSuccess()).isFalse();
    }

    @Test
    void shouldFailOnNonFiniteObservation() {
        double[][] frames = new double[12][];
        for (int t = 0; t < frames.length; t++)
            frames[t] = new double[]{t % 3, 1};
        frames[5] = new double[]{Double.NaN, 1};
        ItemData data = ItemData.of(new FeatureSequence(frames));

        FitResult result = fitter.fit(data, 2);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).contains("non finite");
    }

    @Test
    void shouldFailWhenVarianceOverflows() {
        ItemData data = ItemData.of(FeatureSequence.of(
                new double[]{1e200}, new double[]{-1e200}, new double[]{1e200}, new double[]{-1e200}));

        FitResult result = fitter.fit(data, 2);

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void shouldFailToScoreOtherDimension() {
        SequenceModel model = fitter.fit(twoRegimes(2, 2), 2).model();
        ItemData twoDimensional = ItemData.of(FeatureSequence.of(new double[]{1, 2}));

        ScoreResult result = fitter.score(model, twoDimensional);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.logLikelihood()).isNaN();
    }

    @Test
    void shouldFailToScoreUnsupportedModel() {
        SequenceModel foreign = new SequenceModel() {
            @Override
            public int numStates() {
                return 2;
            }

            @Override
            public int featureDimension() {
                return 1;
            }
        };

        ScoreResult result = fitter.score(foreign, twoRegimes(2, 1));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).contains("Unsupported model type");
    }

}
