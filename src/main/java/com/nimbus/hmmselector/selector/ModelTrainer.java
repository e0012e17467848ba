package com.nimbus.hmmselector.selector;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.model.SequenceModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one selection strategy over every item of a dataset. Items are independent, so they
 * are spread across a fixed pool of worker threads; results are always reported in the
 * dataset's item order, making a parallel run indistinguishable from a sequential one.
 */
public class ModelTrainer {

    private static final Logger LOG = LogManager.getLogger(ModelTrainer.class);

    private static final int NCPUS = Runtime.getRuntime().availableProcessors();

    private final Dataset dataset;
    private final int concurrency;

    /**
     * @param dataset Dataset the strategies passed to this trainer were built with. Must not
     *                be modified while a run is in progress.
     * @param concurrency Number of items selected at the same time, at least 1
     */
    public ModelTrainer(Dataset dataset, int concurrency) {
        if (dataset == null)
            throw new IllegalArgumentException("Dataset cannot be null");
        if (concurrency < 1)
            throw new IllegalArgumentException("Concurrency must be at least 1");

        this.dataset = dataset;
        this.concurrency = concurrency;
    }

    public ModelTrainer(Dataset dataset) {
        this(dataset, NCPUS);
    }

    /**
     * Select a model for every item, keeping absent results
     * @return Item to result in dataset order
     */
    public Map<String, SelectionResult> selectAll(SelectionStrategy strategy) {
        if (strategy == null)
            throw new IllegalArgumentException("Strategy cannot be null");

        List<String> items = dataset.items();
        Map<String, SelectionResult> results = new LinkedHashMap<>();

        if (concurrency == 1) {
            for (String item : items)
                results.put(item, strategy.select(item));
            return results;
        }

        AtomicInteger complete = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, items.size()));
        ScheduledExecutorService scheduledExecutor = Executors.newSingleThreadScheduledExecutor();
        ScheduledFuture<?> monitor = startMonitor(scheduledExecutor, strategy.type(), complete, items.size());

        try {
            List<CompletableFuture<SelectionResult>> futures = new ArrayList<>(items.size());
            for (String item : items) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    SelectionResult result = strategy.select(item);
                    complete.incrementAndGet();
                    return result;
                }, executor));
            }

            for (int i = 0; i < items.size(); i++)
                results.put(items.get(i), futures.get(i).join());

            return results;
        } catch (CompletionException e) {
            throw new RuntimeException("Model selection failed for " + strategy.type(), e.getCause());
        } finally {
            monitor.cancel(true);
            executor.shutdownNow();
            scheduledExecutor.shutdownNow();
        }
    }

    /**
     * Select a model for every item and collect the present ones for recognition. Items
     * without a model are logged and left out, they can never be guessed.
     */
    public TrainedModels train(SelectionStrategy strategy) {
        Map<String, SelectionResult> results = selectAll(strategy);
        Map<String, SequenceModel> models = new LinkedHashMap<>();

        results.forEach((item, result) -> {
            if (result.isPresent())
                models.put(item, result.getModel().get());
            else
                LOG.warn("No {} model could be selected for {}", strategy.type(), item);
        });

        LOG.info("Trained {} of {} items with {}", models.size(), results.size(), strategy.type());
        return new TrainedModels(strategy.type(), models);
    }

    private ScheduledFuture<?> startMonitor(ScheduledExecutorService scheduledExecutor, SelectorType type,
                                            AtomicInteger complete, int total) {
        long startTime = System.currentTimeMillis();

        return scheduledExecutor.scheduleAtFixedRate(() -> {
            int done = complete.get();
            long elapsedSecs = (System.currentTimeMillis() - startTime) / 1000;

            LOG.info("{} selection: {} of {} items ({}%) | Elapsed: {}s",
                    type, done, total, String.format("%.1f", done * 100f / total), elapsedSecs);
        }, 1, 1, TimeUnit.SECONDS);
    }

    public int getConcurrency() {
        return concurrency;
    }

}
