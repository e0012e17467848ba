package com.nimbus.hmmselector.model;

/**
 * Outcome of scoring observations against a model
 * @param logLikelihood Total log likelihood, NaN on failure
 * @param failure Reason scoring failed, null on success
 */
public record ScoreResult(double logLikelihood, String failure) {

    public static ScoreResult success(double logLikelihood) {
        if (Double.isNaN(logLikelihood) || Double.isInfinite(logLikelihood))
            return failure("Non finite log likelihood " + logLikelihood);

        return new ScoreResult(logLikelihood, null);
    }

    public static ScoreResult failure(String reason) {
        if (reason == null)
            throw new IllegalArgumentException("Failure reason cannot be null");

        return new ScoreResult(Double.NaN, reason);
    }

    public boolean isSuccess() {
        return failure == null;
    }

}
