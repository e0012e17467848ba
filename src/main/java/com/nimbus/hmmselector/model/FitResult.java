package com.nimbus.hmmselector.model;

import java.util.Optional;

/**
 * Outcome of fitting one candidate. Exactly one of model or failure is present.
 * @param model The fitted model, null on failure
 * @param failure Reason the fit failed, null on success
 */
public record FitResult(SequenceModel model, String failure) {

    public FitResult {
        if ((model == null) == (failure == null))
            throw new IllegalArgumentException("Fit result must hold either a model or a failure");
    }

    public static FitResult success(SequenceModel model) {
        return new FitResult(model, null);
    }

    public static FitResult failure(String reason) {
        return new FitResult(null, reason);
    }

    public boolean isSuccess() {
        return model != null;
    }

    public Optional<SequenceModel> asOptional() {
        return Optional.ofNullable(model);
    }

}
