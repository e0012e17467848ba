package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.model.ModelFitter;

/**
 * The closed set of model selection criteria
 */
public enum SelectorType {

    /** Always the configured fixed state count */
    CONSTANT,
    /** Lowest Bayesian information criterion */
    BIC,
    /** Highest discriminative information criterion */
    DIC,
    /** Highest mean held out log likelihood across folds */
    CV;

    public SelectionStrategy create(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        return switch (this) {
            case CONSTANT -> Selectors.constant(dataset, fitter, config);
            case BIC -> Selectors.bic(dataset, fitter, config);
            case DIC -> Selectors.dic(dataset, fitter, config);
            case CV -> Selectors.cv(dataset, fitter, config);
        };
    }

    /**
     * Create a selector of this type backed by a Gaussian HMM fitter seeded from the config
     */
    public SelectionStrategy create(Dataset dataset, SelectorConfig config) {
        return create(dataset, Selectors.defaultFitter(config), config);
    }

}
