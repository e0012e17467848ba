package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;
import com.nimbus.hmmselector.model.ScoreResult;

import java.util.Map;

/**
 * Selects the candidate with the highest discriminative information criterion,
 * {@code DIC = logL(own item) - mean(logL(every other item))}. Rewards models that explain
 * their own item well and the rest of the vocabulary poorly.
 *
 * <p>Reads every item of the dataset for each candidate, so the dataset must stay unchanged
 * for the whole search. A dataset with a single item has no other items to compare against
 * and always yields an absent result.
 */
public class DicSelector extends AbstractModelSelector {

    public DicSelector(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        super(dataset, fitter, config);
    }

    @Override
    protected SelectionResult doSelect(String item, ItemData data) {
        if (dataset.size() < 2) {
            log("DIC needs at least two items, dataset has {}", dataset.size());
            return absent(item);
        }

        ScoredCandidate best = null;

        for (int n = config.minStates(); n <= config.maxStates(); n++) {
            FitResult fit = baseModel(item, data, n);
            if (!fit.isSuccess())
                continue;

            ScoreResult logL = score(item, fit.model(), data);
            if (!logL.isSuccess())
                continue;

            double otherSum = 0;
            boolean failed = false;
            for (Map.Entry<String, ItemData> other : dataset.asMap().entrySet()) {
                if (other.getKey().equals(item))
                    continue;

                ScoreResult otherLogL = scoreOther(item, fit.model(), other.getKey(), other.getValue());
                if (!otherLogL.isSuccess()) {
                    failed = true;
                    break;
                }
                otherSum += otherLogL.logLikelihood();
            }

            if (failed)
                continue;

            double dic = logL.logLikelihood() - otherSum / (dataset.size() - 1);
            log("{} with {} states: logL {} DIC {}", item, n, logL.logLikelihood(), dic);

            if (best == null || dic > best.score())
                best = new ScoredCandidate(fit.model(), n, dic);
        }

        return best == null ? absent(item) : result(item, best);
    }

    @Override
    public SelectorType type() {
        return SelectorType.DIC;
    }

}
