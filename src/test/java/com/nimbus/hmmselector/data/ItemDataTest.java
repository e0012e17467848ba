package com.nimbus.hmmselector.data;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemDataTest {

    private static final FeatureSequence FIRST = FeatureSequence.of(new double[]{1, 2}, new double[]{3, 4});
    private static final FeatureSequence SECOND = FeatureSequence.of(new double[]{5, 6});
    private static final FeatureSequence THIRD = FeatureSequence.of(new double[]{7, 8}, new double[]{9, 10}, new double[]{11, 12});

    @Test
    void shouldStackSequencesWithLengths() {
        ItemData data = ItemData.of(FIRST, SECOND, THIRD);

        assertThat(data.getLengths()).containsExactly(2, 1, 3);
        assertThat(data.observationCount()).isEqualTo(6);
        assertThat(data.sequenceCount()).isEqualTo(3);
        assertThat(data.featureDimension()).isEqualTo(2);
        assertThat(data.getFeatures()[2]).containsExactly(5, 6);
        assertThat(data.getFeatures()[5]).containsExactly(11, 12);
    }

    @Test
    void shouldRejectLengthsNotMatchingMatrixRows() {
        double[][] features = {{1}, {2}, {3}};

        assertThatThrownBy(() -> new ItemData(features, new int[]{1, 1},
                List.of(FeatureSequence.of(new double[]{1}), FeatureSequence.of(new double[]{2}))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match feature row count");
    }

    @Test
    void shouldRejectLengthCountNotMatchingSequenceCount() {
        double[][] features = {{1}, {2}};

        assertThatThrownBy(() -> new ItemData(features, new int[]{2}, List.of(
                FeatureSequence.of(new double[]{1}), FeatureSequence.of(new double[]{2}))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMixedDimensions() {
        assertThatThrownBy(() -> ItemData.of(FIRST, FeatureSequence.of(new double[]{1, 2, 3})))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    void shouldSplitStackedMatrixBackIntoSequences() {
        double[][] features = {{1}, {2}, {3}, {4}};

        ItemData data = ItemData.fromMatrix(features, new int[]{3, 1});

        assertThat(data.getSequences()).hasSize(2);
        assertThat(data.getSequences().get(0).length()).isEqualTo(3);
        assertThat(data.getSequences().get(1).frames()[0]).containsExactly(4);
    }

    @Test
    void shouldRejectLengthsOverrunningMatrix() {
        assertThatThrownBy(() -> ItemData.fromMatrix(new double[][]{{1}, {2}}, new int[]{2, 1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMatrixOfMixedRowWidths() {
        double[][] features = {{1, 2}, {2, 3}, {3, 4}, {5}, {6}, {7}};

        assertThatThrownBy(() -> ItemData.fromMatrix(features, new int[]{3, 3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    void shouldRejectSequencesOfDifferentDimension() {
        FeatureSequence wide = FeatureSequence.of(new double[]{1, 2, 3});
        double[][] features = {FIRST.frames()[0], FIRST.frames()[1], wide.frames()[0]};

        assertThatThrownBy(() -> new ItemData(features, new int[]{2, 1}, List.of(FIRST, wide)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sequence 1 has dimension 3");
    }

    @Test
    void shouldRejectMatrixRowsNotMatchingFrames() {
        double[][] features = {{1, 2}, {3, 99}, {5, 6}};

        assertThatThrownBy(() -> new ItemData(features, new int[]{2, 1}, List.of(FIRST, SECOND)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Feature row 1");
    }

    @Test
    void shouldCombineSubsetInRequestedOrder() {
        ItemData data = ItemData.of(FIRST, SECOND, THIRD);

        ItemData subset = data.subset(new int[]{2, 0});

        assertThat(subset.getLengths()).containsExactly(3, 2);
        assertThat(subset.observationCount()).isEqualTo(5);
        assertThat(subset.getFeatures()[0]).containsExactly(7, 8);
        assertThat(subset.getFeatures()[3]).containsExactly(1, 2);
    }

    @Test
    void shouldRejectSubsetIndexOutOfRange() {
        ItemData data = ItemData.of(FIRST, SECOND);

        assertThatThrownBy(() -> data.subset(new int[]{2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void shouldRejectEmptyOrRaggedSequences() {
        assertThatThrownBy(() -> new FeatureSequence(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeatureSequence(new double[][]{{1, 2}, {3}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
