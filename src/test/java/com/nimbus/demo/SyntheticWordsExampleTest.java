package com.nimbus.demo;

import com.nimbus.hmmselector.recognizer.RecognitionReporter;
import com.nimbus.hmmselector.selector.SelectorConfig;
import com.nimbus.hmmselector.selector.SelectorType;
import com.nimbus.hmmselector.selector.TrainedModels;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SyntheticWordsExampleTest {

    @Test
    void shouldLoadBundledConfig() {
        SelectorConfig config = DemoUtils.loadDemoConfig();

        assertThat(config.minStates()).isEqualTo(2);
        assertThat(config.maxStates()).isEqualTo(5);
        assertThat(config.maxIterations()).isEqualTo(200);
    }

    @Test
    void shouldRecognizeSyntheticWordsWithEverySelector() {
        Map<SelectorType, TrainedModels> trained = new EnumMap<>(SelectorType.class);

        Map<SelectorType, RecognitionReporter> reports = SyntheticWordsExample.run(DemoUtils.loadDemoConfig(), trained);

        assertThat(reports).containsOnlyKeys(SelectorType.values());
        assertThat(trained).containsOnlyKeys(SelectorType.values());
        reports.values().forEach(report -> assertThat(report.getTotal()).isEqualTo(DemoUtils.WORDS.size() * 2));
        assertThat(reports.get(SelectorType.BIC).getAccuracy()).isGreaterThanOrEqualTo(0.8f);
        assertThat(trained.get(SelectorType.BIC).items()).containsExactlyElementsOf(DemoUtils.WORDS);
    }

}
