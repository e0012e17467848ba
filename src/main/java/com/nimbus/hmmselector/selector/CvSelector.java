package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.FoldSplit;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.data.KFold;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;
import com.nimbus.hmmselector.model.ScoreResult;
import org.apache.commons.math3.stat.StatUtils;

import java.util.List;

/**
 * Selects the state count with the highest mean held out log likelihood over
 * {@link SelectorConfig#foldCount()} folds of the item's own sequences, then refits that
 * state count once on all of the item's data. Fold models only produce scores and are
 * discarded.
 *
 * <p>Items with fewer sequences than folds, and items where no candidate survives a
 * single fold, fall back to {@link SelectorConfig#fixedConstant()} states.
 */
public class CvSelector extends AbstractModelSelector {

    public CvSelector(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        super(dataset, fitter, config);
    }

    @Override
    protected SelectionResult doSelect(String item, ItemData data) {
        int folds = config.foldCount();
        if (data.sequenceCount() < folds) {
            log("{} has {} sequences, too few for {} folds, using {} states",
                    item, data.sequenceCount(), folds, config.fixedConstant());
            return refit(item, data, config.fixedConstant(), Double.NaN);
        }

        List<FoldSplit> splits = new KFold(folds).split(data.sequenceCount());

        int bestStates = -1;
        double bestScore = Double.NaN;
        for (int n = config.minStates(); n <= config.maxStates(); n++) {
            double mean = crossValidate(item, data, splits, n);
            if (Double.isNaN(mean))
                continue;

            log("{} with {} states: mean held out logL {}", item, n, mean);

            if (bestStates < 0 || mean > bestScore) {
                bestStates = n;
                bestScore = mean;
            }
        }

        if (bestStates < 0) {
            log("No candidate survived cross validation for {}, using {} states", item, config.fixedConstant());
            return refit(item, data, config.fixedConstant(), Double.NaN);
        }

        return refit(item, data, bestStates, bestScore);
    }

    /**
     * @return Mean log likelihood of the held out sequences over every fold that could be
     * fitted and scored, or NaN if none could
     */
    private double crossValidate(String item, ItemData data, List<FoldSplit> splits, int numStates) {
        double[] scores = new double[splits.size()];
        int scored = 0;

        for (FoldSplit split : splits) {
            ItemData train = data.subset(split.trainIndices());
            ItemData test = data.subset(split.testIndices());

            FitResult fit = baseModel(item, train, numStates);
            if (!fit.isSuccess())
                continue;

            ScoreResult logL = score(item, fit.model(), test);
            if (!logL.isSuccess())
                continue;

            scores[scored++] = logL.logLikelihood();
        }

        return scored == 0 ? Double.NaN : StatUtils.mean(scores, 0, scored);
    }

    private SelectionResult refit(String item, ItemData data, int numStates, double score) {
        FitResult fit = baseModel(item, data, numStates);

        return fit.isSuccess()
                ? result(item, new ScoredCandidate(fit.model(), numStates, score))
                : absent(item);
    }

    @Override
    public SelectorType type() {
        return SelectorType.CV;
    }

}
