package com.nimbus.hmmselector.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Item name to {@link ItemData} mapping shared read only by every selector of a run.
 * Iteration order is the insertion order of the source map.
 */
public final class Dataset {

    private final Map<String, ItemData> items;
    private final int featureDimension;

    public Dataset(Map<String, ItemData> items) {
        if (items == null || items.isEmpty())
            throw new IllegalArgumentException("Dataset must contain at least one item");

        int dimension = -1;
        for (Map.Entry<String, ItemData> entry : items.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty())
                throw new IllegalArgumentException("Item name cannot be null or empty");
            if (entry.getValue() == null)
                throw new IllegalArgumentException("Item " + entry.getKey() + " has no data");

            int itemDimension = entry.getValue().featureDimension();
            if (dimension == -1)
                dimension = itemDimension;
            else if (dimension != itemDimension)
                throw new IllegalArgumentException("Item " + entry.getKey() + " has feature dimension "
                        + itemDimension + ", expected " + dimension);
        }

        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        this.featureDimension = dimension;
    }

    /**
     * Build a dataset straight from raw sequences per item
     */
    public static Dataset ofSequences(Map<String, List<FeatureSequence>> sequences) {
        Map<String, ItemData> items = new LinkedHashMap<>();
        sequences.forEach((item, itemSequences) -> items.put(item, ItemData.of(itemSequences)));
        return new Dataset(items);
    }

    /**
     * @throws IllegalArgumentException if the item is not part of this dataset
     */
    public ItemData get(String item) {
        ItemData data = items.get(item);
        if (data == null)
            throw new IllegalArgumentException("Unknown item " + item);
        return data;
    }

    public boolean contains(String item) {
        return items.containsKey(item);
    }

    public List<String> items() {
        return new ArrayList<>(items.keySet());
    }

    public Map<String, ItemData> asMap() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public int featureDimension() {
        return featureDimension;
    }

}
