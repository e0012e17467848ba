package com.nimbus.hmmselector.hmm;

import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;
import com.nimbus.hmmselector.model.ScoreResult;
import com.nimbus.hmmselector.model.SequenceModel;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Baum-Welch (EM) fitter for diagonal covariance {@link GaussianHmm}s. State means are
 * seeded from k-means++ clustering of all observations using the configured random seed,
 * so repeated fits of the same data always produce the same model. Stateless between
 * calls and safe to share across threads.
 */
public class GaussianHmmFitter implements ModelFitter {

    private static final Logger LOG = LogManager.getLogger(GaussianHmmFitter.class);

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-2;
    public static final double DEFAULT_MIN_COVAR = 1e-3;

    private static final int KMEANS_MAX_ITERATIONS = 300;

    private final long randomSeed;
    private final int maxIterations;
    private final double tolerance;
    private final double minCovar;

    /**
     * @param randomSeed Seed for the initial clustering
     * @param maxIterations Cap on EM iterations per fit
     * @param tolerance Stop once an iteration improves the log likelihood by less than this
     * @param minCovar Floor added to every variance to keep emissions non degenerate
     */
    public GaussianHmmFitter(long randomSeed, int maxIterations, double tolerance, double minCovar) {
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be at least 1");
        if (tolerance < 0)
            throw new IllegalArgumentException("tolerance cannot be negative");
        if (!(minCovar > 0))
            throw new IllegalArgumentException("minCovar must be positive");

        this.randomSeed = randomSeed;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minCovar = minCovar;
    }

    public GaussianHmmFitter(long randomSeed, int maxIterations, double tolerance) {
        this(randomSeed, maxIterations, tolerance, DEFAULT_MIN_COVAR);
    }

    public GaussianHmmFitter(long randomSeed) {
        this(randomSeed, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, DEFAULT_MIN_COVAR);
    }

    @Override
    public FitResult fit(ItemData data, int numStates) {
        if (numStates < 1)
            return FitResult.failure("State count must be at least 1, got " + numStates);
        if (numStates > data.observationCount())
            return FitResult.failure("Cannot fit " + numStates + " states to " + data.observationCount() + " observations");

        FitResult initial = initialise(data, numStates);
        if (!initial.isSuccess())
            return initial;

        GaussianHmm model = (GaussianHmm) initial.model();
        double previous = Double.NEGATIVE_INFINITY;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Statistics stats = expectation(model, data);

            if (!Double.isFinite(stats.logLikelihood))
                return FitResult.failure("Non finite log likelihood at iteration " + iteration);

            if (stats.logLikelihood - previous < tolerance) {
                LOG.debug("Converged after {} iterations with {} states, log likelihood {}",
                        iteration, numStates, stats.logLikelihood);
                return FitResult.success(model);
            }

            FitResult next = maximise(stats, data.sequenceCount());
            if (!next.isSuccess())
                return next;

            model = (GaussianHmm) next.model();
            previous = stats.logLikelihood;
        }

        LOG.debug("Reached iteration cap {} with {} states", maxIterations, numStates);
        return FitResult.success(model);
    }

    @Override
    public ScoreResult score(SequenceModel model, ItemData data) {
        if (!(model instanceof GaussianHmm))
            return ScoreResult.failure("Unsupported model type " + (model == null ? "null" : model.getClass().getName()));

        if (model.featureDimension() != data.featureDimension())
            return ScoreResult.failure("Model expects dimension " + model.featureDimension()
                    + " but data has " + data.featureDimension());

        return ScoreResult.success(ForwardBackward.logLikelihood((GaussianHmm) model, data));
    }

    private FitResult initialise(ItemData data, int numStates) {
        double[][] features = data.getFeatures();
        int dimension = data.featureDimension();

        for (int t = 0; t < features.length; t++) {
            for (double value : features[t]) {
                if (!Double.isFinite(value))
                    return FitResult.failure("Observation " + t + " holds non finite value " + value);
            }
        }

        List<DoublePoint> points = new ArrayList<>(features.length);
        for (double[] frame : features)
            points.add(new DoublePoint(frame));

        List<CentroidCluster<DoublePoint>> clusters;
        try {
            KMeansPlusPlusClusterer<DoublePoint> clusterer = new KMeansPlusPlusClusterer<>(numStates,
                    KMEANS_MAX_ITERATIONS, new EuclideanDistance(), new Well19937c(randomSeed));
            clusters = clusterer.cluster(points);
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            return FitResult.failure("Initial clustering failed: " + e.getMessage());
        }

        if (clusters.size() != numStates)
            return FitResult.failure("Initial clustering produced " + clusters.size() + " of " + numStates + " clusters");

        double[][] means = new double[numStates][];
        for (int s = 0; s < numStates; s++) {
            means[s] = clusters.get(s).getCenter().getPoint().clone();
            for (int other = 0; other < s; other++) {
                if (Arrays.equals(means[s], means[other]))
                    return FitResult.failure("Initial clustering found fewer than " + numStates + " distinct centroids");
            }
        }

        double[] variance = new double[dimension];
        double[] column = new double[features.length];
        for (int d = 0; d < dimension; d++) {
            for (int t = 0; t < features.length; t++)
                column[t] = features[t][d];
            variance[d] = StatUtils.variance(column) + minCovar;
        }

        double[] startProb = new double[numStates];
        double[][] transMat = new double[numStates][numStates];
        double[][] covars = new double[numStates][];
        Arrays.fill(startProb, 1.0 / numStates);
        for (int s = 0; s < numStates; s++) {
            Arrays.fill(transMat[s], 1.0 / numStates);
            covars[s] = variance.clone();
        }

        return build(startProb, transMat, means, covars);
    }

    private Statistics expectation(GaussianHmm model, ItemData data) {
        int n = model.numStates();
        int dimension = model.featureDimension();
        double[][] features = data.getFeatures();
        double[] logStart = ForwardBackward.log(model.getStartProb());
        double[][] logTrans = ForwardBackward.log(model.getTransMat());

        Statistics stats = new Statistics(n, dimension);

        int offset = 0;
        for (int length : data.getLengths()) {
            double[][] logB = ForwardBackward.logEmissions(model, features, offset, length);
            double[][] alpha = ForwardBackward.forward(logStart, logTrans, logB);
            double[][] beta = ForwardBackward.backward(logTrans, logB);
            double sequenceLogLikelihood = ForwardBackward.logSumExp(alpha[length - 1]);

            if (!Double.isFinite(sequenceLogLikelihood)) {
                stats.logLikelihood = sequenceLogLikelihood;
                return stats;
            }
            stats.logLikelihood += sequenceLogLikelihood;

            for (int t = 0; t < length; t++) {
                double[] x = features[offset + t];
                for (int i = 0; i < n; i++) {
                    double gamma = Math.exp(alpha[t][i] + beta[t][i] - sequenceLogLikelihood);
                    if (t == 0)
                        stats.start[i] += gamma;
                    stats.occupancy[i] += gamma;
                    for (int d = 0; d < dimension; d++) {
                        stats.observationSum[i][d] += gamma * x[d];
                        stats.observationSquareSum[i][d] += gamma * x[d] * x[d];
                    }

                    if (t < length - 1) {
                        for (int j = 0; j < n; j++) {
                            stats.transitions[i][j] += Math.exp(alpha[t][i] + logTrans[i][j]
                                    + logB[t + 1][j] + beta[t + 1][j] - sequenceLogLikelihood);
                        }
                    }
                }
            }

            offset += length;
        }

        return stats;
    }

    private FitResult maximise(Statistics stats, int sequences) {
        int n = stats.start.length;
        int dimension = stats.observationSum[0].length;

        double[] startProb = new double[n];
        double[][] transMat = new double[n][n];
        double[][] means = new double[n][dimension];
        double[][] covars = new double[n][dimension];

        for (int i = 0; i < n; i++) {
            startProb[i] = stats.start[i] / sequences;

            double rowSum = 0;
            for (int j = 0; j < n; j++)
                rowSum += stats.transitions[i][j];
            if (!(rowSum > 0) || !Double.isFinite(rowSum))
                return FitResult.failure("Transition row of state " + i + " collapsed to zero");
            for (int j = 0; j < n; j++)
                transMat[i][j] = stats.transitions[i][j] / rowSum;

            double occupancy = stats.occupancy[i];
            if (!(occupancy > Double.MIN_NORMAL) || !Double.isFinite(occupancy))
                return FitResult.failure("State " + i + " has no occupancy");

            for (int d = 0; d < dimension; d++) {
                double mean = stats.observationSum[i][d] / occupancy;
                double variance = stats.observationSquareSum[i][d] / occupancy - mean * mean;
                means[i][d] = mean;
                covars[i][d] = Math.max(variance, 0) + minCovar;
            }
        }

        return build(startProb, transMat, means, covars);
    }

    /**
     * Wrap estimated parameters in a model, failing instead of throwing when an estimate
     * overflowed or is otherwise not a valid probability model
     */
    private static FitResult build(double[] startProb, double[][] transMat, double[][] means, double[][] covars) {
        for (int i = 0; i < startProb.length; i++) {
            if (!Double.isFinite(startProb[i]) || !allFinite(transMat[i]))
                return FitResult.failure("Non finite probabilities estimated for state " + i);
            if (!allFinite(means[i]))
                return FitResult.failure("Non finite mean estimated for state " + i);
            for (double variance : covars[i]) {
                if (!Double.isFinite(variance) || !(variance > 0))
                    return FitResult.failure("Invalid variance " + variance + " estimated for state " + i);
            }
        }

        return FitResult.success(new GaussianHmm(startProb, transMat, means, covars));
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value))
                return false;
        }
        return true;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Expected sufficient statistics accumulated over every sequence of one E step
     */
    private static class Statistics {
        private final double[] start;
        private final double[] occupancy;
        private final double[][] transitions;
        private final double[][] observationSum;
        private final double[][] observationSquareSum;
        private double logLikelihood;

        private Statistics(int states, int dimension) {
            this.start = new double[states];
            this.occupancy = new double[states];
            this.transitions = new double[states][states];
            this.observationSum = new double[states][dimension];
            this.observationSquareSum = new double[states][dimension];
        }
    }

}
