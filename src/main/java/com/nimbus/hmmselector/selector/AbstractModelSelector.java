package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.model.FitResult;
import com.nimbus.hmmselector.model.ModelFitter;
import com.nimbus.hmmselector.model.ScoreResult;
import com.nimbus.hmmselector.model.SequenceModel;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared plumbing for the selectors. {@link #select(String)} resolves the item's data and
 * delegates to {@link #doSelect(String, ItemData)}, while {@link #baseModel} and
 * {@link #score} wrap the fitter so every failed candidate is logged the same way before
 * the subclass drops it.
 *
 * <p>Subclasses keep no state between calls; one instance may serve many threads as long
 * as the dataset is not modified.
 */
public abstract class AbstractModelSelector implements SelectionStrategy {

    private static final Logger LOG = LogManager.getLogger(AbstractModelSelector.class);

    protected final Dataset dataset;
    protected final ModelFitter fitter;
    protected final SelectorConfig config;

    protected AbstractModelSelector(Dataset dataset, ModelFitter fitter, SelectorConfig config) {
        if (dataset == null || fitter == null || config == null)
            throw new IllegalArgumentException("Dataset, fitter and config cannot be null");

        this.dataset = dataset;
        this.fitter = fitter;
        this.config = config;
    }

    @Override
    public final SelectionResult select(String item) {
        ItemData data = dataset.get(item);
        SelectionResult result = doSelect(item, data);

        log("{} selected for {}", type(), result);
        return result;
    }

    /**
     * @param item The item being selected for
     * @param data That item's data, never null
     * @return Never null, use {@link #absent(String)} when nothing could be selected
     */
    protected abstract SelectionResult doSelect(String item, ItemData data);

    /**
     * Fit one candidate, logging the outcome
     */
    protected FitResult baseModel(String item, ItemData data, int numStates) {
        FitResult result = fitter.fit(data, numStates);

        if (result.isSuccess())
            log("Model created for {} with {} states", item, numStates);
        else
            log("Failure on {} with {} states: {}", item, numStates, result.failure());

        return result;
    }

    protected ScoreResult score(String item, SequenceModel model, ItemData data) {
        ScoreResult result = fitter.score(model, data);

        if (!result.isSuccess())
            log("Scoring failed for {} with {} states: {}", item, model.numStates(), result.failure());

        return result;
    }

    /**
     * Score the model trained for item on the data of a different item, logging failures
     * against the model's own item
     */
    protected ScoreResult scoreOther(String item, SequenceModel model, String otherItem, ItemData otherData) {
        ScoreResult result = fitter.score(model, otherData);

        if (!result.isSuccess())
            log("Scoring {} failed for the {} model with {} states: {}",
                    otherItem, item, model.numStates(), result.failure());

        return result;
    }

    protected SelectionResult absent(String item) {
        return SelectionResult.absent(item, type());
    }

    protected SelectionResult result(String item, ScoredCandidate candidate) {
        return SelectionResult.of(item, type(), candidate);
    }

    protected void log(String message, Object... params) {
        LOG.log(config.verbose() ? Level.INFO : Level.DEBUG, message, params);
    }

    public SelectorConfig getConfig() {
        return config;
    }

}
