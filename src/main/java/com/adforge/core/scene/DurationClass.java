package com.adforge.core.scene;

/**
 * Clip durations the video provider accepts. Source durations are always snapped to one of these.
 */
public enum DurationClass {
    TEN(10),
    FIFTEEN(15);

    public static final DurationClass DEFAULT = TEN;

    private final int seconds;

    DurationClass(int seconds) {
        this.seconds = seconds;
    }

    public int seconds() {
        return seconds;
    }

    /**
     * Nearest allowed class; ties go to the shorter class. Missing, non-finite or non-positive
     * durations map to {@link #DEFAULT}.
     */
    public static DurationClass nearest(Double sourceSeconds) {
        if (sourceSeconds == null || sourceSeconds.isNaN() || sourceSeconds.isInfinite() || sourceSeconds <= 0) {
            return DEFAULT;
        }
        DurationClass best = null;
        double bestDistance = Double.MAX_VALUE;
        for (DurationClass candidate : values()) {
            double distance = Math.abs(candidate.seconds - sourceSeconds);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
