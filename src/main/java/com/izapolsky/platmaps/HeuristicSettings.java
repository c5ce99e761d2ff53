package com.izapolsky.platmaps;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Tunable thresholds of the reference extraction heuristic. Values are empirical,
 * taken from how plat sheets of the county cross reference each other.
 */
public class HeuristicSettings {

    public static final int DEFAULT_MIN_NUMERAL = 1;
    public static final int DEFAULT_MAX_NUMERAL = 50;
    public static final int DEFAULT_FALLBACK_THRESHOLD = 3;
    public static final List<Integer> DEFAULT_FALLBACK_OFFSETS = ImmutableList.of(-1, 1, 10, -10);
    public static final int DEFAULT_MIN_SEQUENCE = 1;
    public static final int DEFAULT_MAX_SEQUENCE = 99;

    private int minNumeral = DEFAULT_MIN_NUMERAL;
    private int maxNumeral = DEFAULT_MAX_NUMERAL;
    private int fallbackThreshold = DEFAULT_FALLBACK_THRESHOLD;
    private List<Integer> fallbackOffsets = DEFAULT_FALLBACK_OFFSETS;
    private int minFallbackSequence = DEFAULT_MIN_SEQUENCE;
    private int maxFallbackSequence = DEFAULT_MAX_SEQUENCE;

    public static HeuristicSettings defaults() {
        return new HeuristicSettings();
    }

    public int getMinNumeral() {
        return minNumeral;
    }

    public int getMaxNumeral() {
        return maxNumeral;
    }

    /**
     * Inclusive range of bare numerals read as sheet numbers. Anything outside is taken for a lot or parcel number.
     */
    public HeuristicSettings setNumeralRange(int min, int max) {
        Preconditions.checkArgument(min >= 1 && min <= max, "Invalid numeral range [%s, %s]", min, max);
        this.minNumeral = min;
        this.maxNumeral = max;
        return this;
    }

    public int getFallbackThreshold() {
        return fallbackThreshold;
    }

    /**
     * Neighbour guesses are added when fewer than this many candidates were found in the text
     */
    public HeuristicSettings setFallbackThreshold(int fallbackThreshold) {
        Preconditions.checkArgument(fallbackThreshold >= 0, "Negative fallback threshold %s", fallbackThreshold);
        this.fallbackThreshold = fallbackThreshold;
        return this;
    }

    public List<Integer> getFallbackOffsets() {
        return fallbackOffsets;
    }

    public HeuristicSettings setFallbackOffsets(List<Integer> fallbackOffsets) {
        this.fallbackOffsets = ImmutableList.copyOf(fallbackOffsets);
        return this;
    }

    public int getMinFallbackSequence() {
        return minFallbackSequence;
    }

    public int getMaxFallbackSequence() {
        return maxFallbackSequence;
    }

    public HeuristicSettings setFallbackSequenceRange(int min, int max) {
        Preconditions.checkArgument(min >= 1 && min <= max, "Invalid fallback range [%s, %s]", min, max);
        this.minFallbackSequence = min;
        this.maxFallbackSequence = max;
        return this;
    }
}
