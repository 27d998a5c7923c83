package com.allsets.plays.provider;

/**
 * Outcome of one step of a fallback chain.
 * A failed resolution always carries a count of 0 and lets the next step run.
 */
public record Resolution(long count, boolean succeeded) {

    private static final Resolution FAILED = new Resolution(0, false);

    public static Resolution of(long count) {
        return new Resolution(Math.max(0, count), true);
    }

    public static Resolution failed() {
        return FAILED;
    }
}
