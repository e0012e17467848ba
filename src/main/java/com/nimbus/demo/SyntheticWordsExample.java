package com.nimbus.demo;

import com.nimbus.hmmselector.data.Dataset;
import com.nimbus.hmmselector.data.FeatureSequence;
import com.nimbus.hmmselector.data.ItemData;
import com.nimbus.hmmselector.hmm.GaussianHmmFitter;
import com.nimbus.hmmselector.recognizer.RecognitionReporter;
import com.nimbus.hmmselector.recognizer.RecognitionResult;
import com.nimbus.hmmselector.recognizer.Recognizer;
import com.nimbus.hmmselector.selector.ModelTrainer;
import com.nimbus.hmmselector.selector.SelectorConfig;
import com.nimbus.hmmselector.selector.SelectorType;
import com.nimbus.hmmselector.selector.Selectors;
import com.nimbus.hmmselector.selector.TrainedModels;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Trains every selector on a small synthetic vocabulary and reports the word error rate of
 * each on held out sequences. Pass a file path to also save the BIC models there.
 */
public class SyntheticWordsExample {

    public static void main(String[] args) throws IOException {
        SelectorConfig config = DemoUtils.loadDemoConfig();

        Map<SelectorType, TrainedModels> trained = new EnumMap<>(SelectorType.class);
        Map<SelectorType, RecognitionReporter> reports = run(config, trained);

        reports.forEach((type, report) -> {
            System.out.printf("%s: WER %.3f (%d of %d correct)%n",
                    type, report.getWordErrorRate(), report.getCorrect(), report.getTotal());
            report.getWordReports().forEach((word, r) ->
                    System.out.println("  " + word + " -> " + r.getCorrect() + " ? " + r.getSamples()));
        });

        if (args.length > 0) {
            trained.get(SelectorType.BIC).saveModels(Path.of(args[0]));
            System.out.println("Saved BIC models to " + args[0]);
        }
    }

    /**
     * @param trained Receives the trained models of every selector type
     * @return Recognition report per selector type
     */
    public static Map<SelectorType, RecognitionReporter> run(SelectorConfig config, Map<SelectorType, TrainedModels> trained) {
        Dataset training = Dataset.ofSequences(DemoUtils.generateWords(DemoUtils.WORDS, 6, config.randomSeed()));

        List<ItemData> testSequences = new ArrayList<>();
        List<String> actual = new ArrayList<>();
        DemoUtils.generateWords(DemoUtils.WORDS, 2, config.randomSeed() + 1).forEach((word, sequences) -> {
            for (FeatureSequence sequence : sequences) {
                testSequences.add(ItemData.of(sequence));
                actual.add(word);
            }
        });

        GaussianHmmFitter fitter = Selectors.defaultFitter(config);
        ModelTrainer trainer = new ModelTrainer(training);
        Recognizer recognizer = new Recognizer(fitter);

        Map<SelectorType, RecognitionReporter> reports = new EnumMap<>(SelectorType.class);
        for (SelectorType type : SelectorType.values()) {
            TrainedModels models = trainer.train(type.create(training, fitter, config));
            trained.put(type, models);

            RecognitionResult result = recognizer.recognize(models, testSequences);
            reports.put(type, RecognitionReporter.of(result, actual));
        }

        return reports;
    }

}
