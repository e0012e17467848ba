package com.nimbus.hmmselector.hmm;

import com.nimbus.hmmselector.data.ItemData;

/**
 * Log space forward and backward recursions for {@link GaussianHmm}. All lattices are
 * indexed [time][state] and cover a single sequence.
 */
public final class ForwardBackward {

    private static final double LOG_2PI = Math.log(2 * Math.PI);

    private ForwardBackward() {}

    public static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values)
            max = Math.max(max, v);

        if (max == Double.NEGATIVE_INFINITY || Double.isNaN(max))
            return max;

        double sum = 0;
        for (double v : values)
            sum += Math.exp(v - max);

        return max + Math.log(sum);
    }

    public static double[] log(double[] values) {
        double[] logs = new double[values.length];
        for (int i = 0; i < values.length; i++)
            logs[i] = Math.log(values[i]);
        return logs;
    }

    public static double[][] log(double[][] values) {
        double[][] logs = new double[values.length][];
        for (int i = 0; i < values.length; i++)
            logs[i] = log(values[i]);
        return logs;
    }

    /**
     * Log density of a diagonal covariance Gaussian
     */
    public static double logDensity(double[] x, double[] mean, double[] variance) {
        double sum = x.length * LOG_2PI;
        for (int d = 0; d < x.length; d++) {
            double diff = x[d] - mean[d];
            sum += Math.log(variance[d]) + diff * diff / variance[d];
        }
        return -0.5 * sum;
    }

    /**
     * @return Emission log densities of frames [offset, offset + length) for every state
     */
    public static double[][] logEmissions(GaussianHmm model, double[][] features, int offset, int length) {
        int n = model.numStates();
        double[][] logB = new double[length][n];
        for (int t = 0; t < length; t++) {
            for (int s = 0; s < n; s++)
                logB[t][s] = logDensity(features[offset + t], model.getMeans()[s], model.getCovars()[s]);
        }
        return logB;
    }

    public static double[][] forward(double[] logStart, double[][] logTrans, double[][] logB) {
        int length = logB.length;
        int n = logStart.length;
        double[][] alpha = new double[length][n];
        double[] work = new double[n];

        for (int s = 0; s < n; s++)
            alpha[0][s] = logStart[s] + logB[0][s];

        for (int t = 1; t < length; t++) {
            for (int j = 0; j < n; j++) {
                for (int i = 0; i < n; i++)
                    work[i] = alpha[t - 1][i] + logTrans[i][j];
                alpha[t][j] = logSumExp(work) + logB[t][j];
            }
        }

        return alpha;
    }

    public static double[][] backward(double[][] logTrans, double[][] logB) {
        int length = logB.length;
        int n = logTrans.length;
        double[][] beta = new double[length][n];
        double[] work = new double[n];

        for (int t = length - 2; t >= 0; t--) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++)
                    work[j] = logTrans[i][j] + logB[t + 1][j] + beta[t + 1][j];
                beta[t][i] = logSumExp(work);
            }
        }

        return beta;
    }

    /**
     * @return Sum of the log likelihoods of every sequence in data, which may be
     * non finite for degenerate models
     */
    public static double logLikelihood(GaussianHmm model, ItemData data) {
        double[] logStart = log(model.getStartProb());
        double[][] logTrans = log(model.getTransMat());

        double total = 0;
        int offset = 0;
        for (int length : data.getLengths()) {
            double[][] logB = logEmissions(model, data.getFeatures(), offset, length);
            double[][] alpha = forward(logStart, logTrans, logB);
            total += logSumExp(alpha[length - 1]);
            offset += length;
        }

        return total;
    }

}
