package com.nimbus.hmmselector.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Unshuffled k-fold splitter. Sequences are partitioned into contiguous folds where
 * the first {@code samples % folds} folds receive one extra sample, and each fold is
 * held out exactly once.
 */
public class KFold {

    private final int folds;

    public KFold(int folds) {
        if (folds < 2)
            throw new IllegalArgumentException("Fold count must be at least 2");

        this.folds = folds;
    }

    /**
     * @param samples Number of samples (sequences) to split
     * @return One {@link FoldSplit} per fold in fold order
     * @throws IllegalArgumentException if there are fewer samples than folds
     */
    public List<FoldSplit> split(int samples) {
        if (samples < folds)
            throw new IllegalArgumentException("Cannot split " + samples + " samples into " + folds + " folds");

        List<FoldSplit> splits = new ArrayList<>(folds);
        int start = 0;
        for (int fold = 0; fold < folds; fold++) {
            int size = samples / folds + (fold < samples % folds ? 1 : 0);
            int end = start + size;

            int[] test = new int[size];
            int[] train = new int[samples - size];
            int t = 0;
            for (int i = 0; i < samples; i++) {
                if (i >= start && i < end)
                    test[i - start] = i;
                else
                    train[t++] = i;
            }

            splits.add(new FoldSplit(train, test));
            start = end;
        }

        return splits;
    }

    public int getFolds() {
        return folds;
    }

}
