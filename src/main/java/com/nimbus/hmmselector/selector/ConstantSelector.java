package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;

/**
 * Baseline selector which ignores the candidate range and always fits
 * {@link SelectorConfig#fixedConstant()} states. The result carries no score.
 */
public class ConstantSelector extends AbstractModelSelector {

    public ConstantSelector(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        super(dataset, fitter, config);
    }

    @Override
    protected SelectionResult doSelect(String item, ItemData data) {
        int states = config.fixedConstant();
        FitResult fit = baseModel(item, data, states);

        return fit.isSuccess()
                ? result(item, new ScoredCandidate(fit.model(), states, Double.NaN))
                : absent(item);
    }

    @Override
    public SelectorType type() {
        return SelectorType.CONSTANT;
    }

}
