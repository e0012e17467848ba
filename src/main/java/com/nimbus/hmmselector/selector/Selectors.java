package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.hmm.GaussianHmmFitter;
import com.nimbus.hmmselector.model.ModelFitter;

public class Selectors {

    private Selectors() {}

    public static GaussianHmmFitter defaultFitter(SelectorConfig config) {
        return new GaussianHmmFitter(config.randomSeed(), config.maxIterations(), config.tolerance());
    }

    public static ConstantSelector constant(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        return new ConstantSelector(dataset, fitter, config);
    }

    public static BicSelector bic(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        return new BicSelector(dataset, fitter, config);
    }

    public static DicSelector dic(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        return new DicSelector(dataset, fitter, config);
    }

    public static CvSelector cv(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        return new CvSelector(dataset, fitter, config);
    }

}
