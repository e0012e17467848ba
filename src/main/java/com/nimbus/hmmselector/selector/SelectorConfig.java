package com.nimbus.hmmselector.selector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbus.hmmselector.ModelObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings shared by every selector of one run. Passed explicitly to each selector so that
 * runs never depend on process wide state.
 * @param minStates Smallest candidate hidden state count, inclusive
 * @param maxStates Largest candidate hidden state count, inclusive
 * @param fixedConstant State count used by the constant selector and as the cross validation fallback
 * @param randomSeed Seed handed to the model fitter so fits are repeatable
 * @param foldCount Number of cross validation folds, at least 2
 * @param maxIterations EM iteration cap of the model fitter
 * @param tolerance EM convergence threshold on log likelihood gain
 * @param verbose true to log every candidate fit at info rather than debug level
 */
public record SelectorConfig(int minStates, int maxStates, int fixedConstant, long randomSeed,
                             int foldCount, int maxIterations, double tolerance, boolean verbose) {

    public static final int DEFAULT_MIN_STATES = 2;
    public static final int DEFAULT_MAX_STATES = 10;
    public static final int DEFAULT_FIXED_CONSTANT = 3;
    public static final long DEFAULT_RANDOM_SEED = 14;
    public static final int DEFAULT_FOLD_COUNT = 3;
    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-2;

    public SelectorConfig(int minStates, int maxStates, int fixedConstant, long randomSeed,
                          int foldCount, int maxIterations, double tolerance, boolean verbose) {
        this.minStates = minStates;
        this.maxStates = maxStates;
        this.fixedConstant = fixedConstant;
        this.randomSeed = randomSeed;
        this.foldCount = foldCount;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.verbose = verbose;

        if (minStates < 1)
            throw new IllegalArgumentException("minStates must be at least 1");
        if (maxStates < minStates)
            throw new IllegalArgumentException("maxStates must be greater or equal to minStates");
        if (fixedConstant < 1)
            throw new IllegalArgumentException("fixedConstant must be at least 1");
        if (foldCount < 2)
            throw new IllegalArgumentException("foldCount must be at least 2");
        if (maxIterations < 1)
            throw new IllegalArgumentException("maxIterations must be at least 1");
        if (tolerance < 0 || Double.isNaN(tolerance))
            throw new IllegalArgumentException("tolerance cannot be negative");
    }

    /**
     * JSON entry point where every property is optional and falls back to its default
     */
    @JsonCreator
    public static SelectorConfig fromJson(
            @JsonProperty("minStates") Integer minStates,
            @JsonProperty("maxStates") Integer maxStates,
            @JsonProperty("fixedConstant") Integer fixedConstant,
            @JsonProperty("randomSeed") Long randomSeed,
            @JsonProperty("foldCount") Integer foldCount,
            @JsonProperty("maxIterations") Integer maxIterations,
            @JsonProperty("tolerance") Double tolerance,
            @JsonProperty("verbose") Boolean verbose) {
        return new SelectorConfig(
                minStates != null ? minStates : DEFAULT_MIN_STATES,
                maxStates != null ? maxStates : DEFAULT_MAX_STATES,
                fixedConstant != null ? fixedConstant : DEFAULT_FIXED_CONSTANT,
                randomSeed != null ? randomSeed : DEFAULT_RANDOM_SEED,
                foldCount != null ? foldCount : DEFAULT_FOLD_COUNT,
                maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS,
                tolerance != null ? tolerance : DEFAULT_TOLERANCE,
                verbose != null && verbose);
    }

    public static SelectorConfig defaults() {
        return new SelectorConfig(DEFAULT_MIN_STATES, DEFAULT_MAX_STATES, DEFAULT_FIXED_CONSTANT,
                DEFAULT_RANDOM_SEED, DEFAULT_FOLD_COUNT, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE, false);
    }

    public static SelectorConfig load(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream);
        } catch (IOException e) {
            throw new IOException("Failed to load selector config from " + path, e);
        }
    }

    public static SelectorConfig load(InputStream inputStream) throws IOException {
        return ModelObjectMapper.MAPPER.readValue(inputStream, SelectorConfig.class);
    }

    public SelectorConfig withStateRange(int minStates, int maxStates) {
        return new SelectorConfig(minStates, maxStates, fixedConstant, randomSeed, foldCount, maxIterations, tolerance, verbose);
    }

    public SelectorConfig withFixedConstant(int fixedConstant) {
        return new SelectorConfig(minStates, maxStates, fixedConstant, randomSeed, foldCount, maxIterations, tolerance, verbose);
    }

    public SelectorConfig withRandomSeed(long randomSeed) {
        return new SelectorConfig(minStates, maxStates, fixedConstant, randomSeed, foldCount, maxIterations, tolerance, verbose);
    }

    public SelectorConfig withFoldCount(int foldCount) {
        return new SelectorConfig(minStates, maxStates, fixedConstant, randomSeed, foldCount, maxIterations, tolerance, verbose);
    }

    public SelectorConfig withVerbose(boolean verbose) {
        return new SelectorConfig(minStates, maxStates, fixedConstant, randomSeed, foldCount, maxIterations, tolerance, verbose);
    }

}
