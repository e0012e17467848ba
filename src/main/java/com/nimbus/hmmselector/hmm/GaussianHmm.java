package com.nimbus.hmmselector.hmm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbus.hmmselector.model.SequenceModel;

import java.util.Arrays;

/**
 * Hidden Markov model with one diagonal covariance Gaussian emission per state. Parameters
 * are fixed once constructed; fitting always produces a new instance.
 */
public class GaussianHmm implements SequenceModel {

    @JsonProperty("startProb")
    private final double[] startProb;
    @JsonProperty("transMat")
    private final double[][] transMat;
    @JsonProperty("means")
    private final double[][] means;
    @JsonProperty("covars")
    private final double[][] covars;

    /**
     * @param startProb Initial state distribution, length n
     * @param transMat Row stochastic n x n transition matrix, transMat[i][j] = P(j | i)
     * @param means Per state emission means, n x D
     * @param covars Per state diagonal emission variances, n x D, all positive
     */
    @JsonCreator
    public GaussianHmm(
            @JsonProperty("startProb") double[] startProb,
            @JsonProperty("transMat") double[][] transMat,
            @JsonProperty("means") double[][] means,
            @JsonProperty("covars") double[][] covars) {
        if (startProb == null || transMat == null || means == null || covars == null)
            throw new IllegalArgumentException("Model parameters cannot be null");

        int n = startProb.length;
        if (n == 0)
            throw new IllegalArgumentException("Model must have at least one state");
        if (transMat.length != n || means.length != n || covars.length != n)
            throw new IllegalArgumentException("Transition, mean and covariance rows must equal the state count " + n);
        if (means[0] == null || means[0].length == 0)
            throw new IllegalArgumentException("Feature dimension must be at least 1");

        int dimension = means[0].length;
        for (int i = 0; i < n; i++) {
            if (transMat[i] == null || transMat[i].length != n)
                throw new IllegalArgumentException("Transition row " + i + " must have " + n + " entries");
            if (means[i] == null || means[i].length != dimension || covars[i] == null || covars[i].length != dimension)
                throw new IllegalArgumentException("Mean and covariance of state " + i + " must have dimension " + dimension);
            for (double variance : covars[i]) {
                if (!(variance > 0))
                    throw new IllegalArgumentException("Variances must be positive, state " + i + " has " + variance);
            }
        }

        this.startProb = startProb;
        this.transMat = transMat;
        this.means = means;
        this.covars = covars;
    }

    @Override
    public int numStates() {
        return startProb.length;
    }

    @Override
    public int featureDimension() {
        return means[0].length;
    }

    public double[] getStartProb() {
        return startProb;
    }

    public double[][] getTransMat() {
        return transMat;
    }

    public double[][] getMeans() {
        return means;
    }

    public double[][] getCovars() {
        return covars;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if (!(o instanceof GaussianHmm))
            return false;

        GaussianHmm that = (GaussianHmm) o;

        return Arrays.equals(startProb, that.startProb)
                && Arrays.deepEquals(transMat, that.transMat)
                && Arrays.deepEquals(means, that.means)
                && Arrays.deepEquals(covars, that.covars);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(startProb);
        result = 31 * result + Arrays.deepHashCode(transMat);
        result = 31 * result + Arrays.deepHashCode(means);
        return 31 * result + Arrays.deepHashCode(covars);
    }

    @Override
    public String toString() {
        return "GaussianHmm{states=" + numStates() + ", dimension=" + featureDimension() + "}";
    }

}
