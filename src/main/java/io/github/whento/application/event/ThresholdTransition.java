package io.github.whento.application.event;

public enum ThresholdTransition {
    REACHED,
    LOST,
    NONE;

    /** An unknown previous count (negative) never produces a transition. */
    public static ThresholdTransition detect(int previousCount, int currentCount, int threshold) {
        if (previousCount < 0) return NONE;
        boolean wasMet = previousCount >= threshold;
        boolean nowMet = currentCount >= threshold;
        if (!wasMet && nowMet) return REACHED;
        if (wasMet && !nowMet) return LOST;
        return NONE;
    }
}
