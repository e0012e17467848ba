package com.nimbus.hmmselector.data;

/**
 * One cross validation split of an item's sequences
 * @param trainIndices Sequence indices to fit on
 * @param testIndices Held out sequence indices to score on
 */
public record FoldSplit(int[] trainIndices, int[] testIndices) {
}
