package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;
import com.nimbus.hmmselector.model.ScoreResult;

/**
 * Selects the candidate with the lowest Bayesian information criterion,
 * {@code BIC = -2 * logL + p * ln(N)}, trading fit on the item's own data against the
 * number of free parameters p. N is the item's total observation count.
 */
public class BicSelector extends AbstractModelSelector {

    public BicSelector(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        super(dataset, fitter, config);
    }

    /**
     * Free parameters of a diagonal covariance Gaussian HMM: transitions, initial
     * state probabilities, and a mean and variance per state and dimension.
     */
    public static int freeParameters(int numStates, int featureDimension) {
        return numStates * (numStates - 1) + (numStates - 1) + 2 * featureDimension * numStates;
    }

    public static double bic(double logLikelihood, int numStates, int featureDimension, int observations) {
        return -2 * logLikelihood + freeParameters(numStates, featureDimension) * Math.log(observations);
    }

    @Override
    protected SelectionResult doSelect(String item, ItemData data) {
        ScoredCandidate best = null;

        for (int n = config.minStates(); n <= config.maxStates(); n++) {
            FitResult fit = baseModel(item, data, n);
            if (!fit.isSuccess())
                continue;

            ScoreResult logL = score(item, fit.model(), data);
            if (!logL.isSuccess())
                continue;

            double bic = bic(logL.logLikelihood(), n, data.featureDimension(), data.observationCount());
            log("{} with {} states: logL {} BIC {}", item, n, logL.logLikelihood(), bic);

            if (best == null || bic < best.score())
                best = new ScoredCandidate(fit.model(), n, bic);
        }

        return best == null ? absent(item) : result(item, best);
    }

    @Override
    public SelectorType type() {
        return SelectorType.BIC;
    }

}
