package com.nimbus.hmmselector.data;

/**
 * One recorded realization of an item, as an ordered list of observation frames.
 * @param frames Observation vectors in time order. Every frame must have the same
 *               number of values, the feature dimension of the sequence.
 */
public record FeatureSequence(double[][] frames) {

    public FeatureSequence(double[][] frames) {
        this.frames = frames;

        if (frames == null || frames.length == 0)
            throw new IllegalArgumentException("Feature sequence must contain at least one frame");

        int dimension = frames[0] == null ? 0 : frames[0].length;
        if (dimension == 0)
            throw new IllegalArgumentException("Feature frames cannot be empty");

        for (double[] frame : frames) {
            if (frame == null || frame.length != dimension)
                throw new IllegalArgumentException("All frames of a sequence must have dimension " + dimension);
        }
    }

    public static FeatureSequence of(double[]... frames) {
        return new FeatureSequence(frames);
    }

    public int length() {
        return frames.length;
    }

    public int dimension() {
        return frames[0].length;
    }

}
