package com.nimbus.hmmselector.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * All training material for one vocabulary item. Holds the stacked feature matrix of every
 * sequence, the parallel sequence lengths which split the matrix back into sequences, and
 * the sequences themselves. Instances are never mutated after construction and may be
 * shared freely between selectors and threads.
 */
public final class ItemData {

    private final double[][] features;
    private final int[] lengths;
    private final List<FeatureSequence> sequences;

    /**
     * @param features Stacked observation matrix, one row per frame
     * @param lengths Length of each sequence in the stacked matrix, in stacking order
     * @param sequences The individual sequences, index aligned with lengths
     */
    public ItemData(double[][] features, int[] lengths, List<FeatureSequence> sequences) {
        if (features == null || lengths == null || sequences == null)
            throw new IllegalArgumentException("Features, lengths and sequences cannot be null");
        if (sequences.isEmpty())
            throw new IllegalArgumentException("Item data must contain at least one sequence");
        if (lengths.length != sequences.size())
            throw new IllegalArgumentException("Expected " + sequences.size() + " sequence lengths but got " + lengths.length);

        int dimension = sequences.get(0).dimension();
        int total = 0;
        for (int i = 0; i < lengths.length; i++) {
            if (sequences.get(i).dimension() != dimension)
                throw new IllegalArgumentException("Sequence " + i + " has dimension " + sequences.get(i).dimension()
                        + ", expected " + dimension);
            if (lengths[i] != sequences.get(i).length())
                throw new IllegalArgumentException("Length " + lengths[i] + " at index " + i
                        + " does not match its sequence of " + sequences.get(i).length() + " frames");
            total += lengths[i];
        }

        if (total != features.length)
            throw new IllegalArgumentException("Sum of sequence lengths " + total
                    + " does not match feature row count " + features.length);

        int row = 0;
        for (int i = 0; i < sequences.size(); i++) {
            for (double[] frame : sequences.get(i).frames()) {
                if (!Arrays.equals(features[row], frame))
                    throw new IllegalArgumentException("Feature row " + row + " does not match its frame in sequence " + i);
                row++;
            }
        }

        this.features = features;
        this.lengths = lengths;
        this.sequences = Collections.unmodifiableList(new ArrayList<>(sequences));
    }

    /**
     * Stack a list of sequences into item data
     */
    public static ItemData of(List<FeatureSequence> sequences) {
        if (sequences == null || sequences.isEmpty())
            throw new IllegalArgumentException("Item data must contain at least one sequence");

        int dimension = sequences.get(0).dimension();
        int rows = sequences.stream().mapToInt(FeatureSequence::length).sum();

        double[][] features = new double[rows][];
        int[] lengths = new int[sequences.size()];

        int row = 0;
        for (int s = 0; s < sequences.size(); s++) {
            FeatureSequence sequence = sequences.get(s);
            if (sequence.dimension() != dimension)
                throw new IllegalArgumentException("Sequence " + s + " has dimension " + sequence.dimension()
                        + ", expected " + dimension);

            lengths[s] = sequence.length();
            for (double[] frame : sequence.frames())
                features[row++] = frame;
        }

        return new ItemData(features, lengths, sequences);
    }

    public static ItemData of(FeatureSequence... sequences) {
        return of(Arrays.asList(sequences));
    }

    /**
     * Split an already stacked matrix back into its sequences, e.g. for a test
     * set provider which only hands out the matrix and its lengths.
     */
    public static ItemData fromMatrix(double[][] features, int[] lengths) {
        if (features == null || lengths == null)
            throw new IllegalArgumentException("Features and lengths cannot be null");

        List<FeatureSequence> sequences = new ArrayList<>(lengths.length);
        int offset = 0;
        for (int length : lengths) {
            if (length <= 0 || offset + length > features.length)
                throw new IllegalArgumentException("Sequence lengths do not fit a matrix of " + features.length + " rows");

            sequences.add(new FeatureSequence(Arrays.copyOfRange(features, offset, offset + length)));
            offset += length;
        }

        return new ItemData(features, lengths, sequences);
    }

    /**
     * Re-derive stacked features and lengths for a subset of this item's sequences,
     * in the order given. Used to build cross validation train and test splits.
     * @param sequenceIndices Indices into {@link #getSequences()}
     */
    public ItemData subset(int[] sequenceIndices) {
        if (sequenceIndices == null || sequenceIndices.length == 0)
            throw new IllegalArgumentException("Subset must select at least one sequence");

        List<FeatureSequence> selected = new ArrayList<>(sequenceIndices.length);
        for (int index : sequenceIndices) {
            if (index < 0 || index >= sequences.size())
                throw new IllegalArgumentException("Sequence index " + index + " out of range 0.." + (sequences.size() - 1));
            selected.add(sequences.get(index));
        }

        return of(selected);
    }

    /**
     * @return The stacked observation matrix. Callers must treat it as read only.
     */
    public double[][] getFeatures() {
        return features;
    }

    /**
     * @return Sequence lengths in stacking order. Callers must treat it as read only.
     */
    public int[] getLengths() {
        return lengths;
    }

    public List<FeatureSequence> getSequences() {
        return sequences;
    }

    /**
     * @return Total number of frames across all sequences
     */
    public int observationCount() {
        return features.length;
    }

    public int featureDimension() {
        return sequences.get(0).dimension();
    }

    public int sequenceCount() {
        return sequences.size();
    }

}
