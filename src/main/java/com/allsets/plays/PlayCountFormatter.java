package com.allsets.plays;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatting conventions shared by aggregation and sort mode.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public final class PlayCountFormatter {
    private PlayCountFormatter() {}

    public static final String PLAYS_MARKER = "🎧";
    public static final String SETS_MARKER = "🎶";
    static final String ANNOTATION_SEPARATOR = " _//_ ";

    /**
     * Formats a play count with "k" for thousands and "M" for millions, one decimal each.
     * @param plays Non-negative play count
     * @return e.g. {@code 950}, {@code 1.5k}, {@code 2.3M}
     */
    public static String formatPlays(long plays) {
        if (plays >= 1_000_000) {
            return oneDecimal(plays / 1_000_000.0) + "M";
        }
        if (plays >= 1_000) {
            return oneDecimal(plays / 1_000.0) + "k";
        }
        return Long.toString(plays);
    }

    // Rounds the exact binary value half-to-even: 1.25 -> 1.2, while 1.15 (stored as 1.1499...) -> 1.1.
    private static String oneDecimal(double value) {
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Reverses {@link #formatPlays(long)} for a number and optional magnitude suffix.
     * Precision lost by formatting stays lost: {@code 2.5k} becomes 2500.
     */
    public static long parsePlays(String number, String suffix) {
        double value = Double.parseDouble(number);
        if ("M".equals(suffix)) value *= 1_000_000;
        else if ("k".equals(suffix)) value *= 1_000;
        return Math.round(value);
    }

    /**
     * Builds the output line of a linked set; the annotation is only added for positive counts.
     */
    public static String formatEntry(SetEntry entry, long plays) {
        String base = "* [" + entry.name() + "](" + entry.link() + ")";
        if (plays > 0) {
            return base + ANNOTATION_SEPARATOR + formatPlays(plays) + PLAYS_MARKER;
        }
        return base;
    }

    public static String formatTotalPlays(long totalPlays) {
        return "Total plays: **" + formatPlays(totalPlays) + PLAYS_MARKER + "**";
    }

    public static String formatTotalSets(long totalSets) {
        return "Total amount of sets: **" + totalSets + SETS_MARKER + "**";
    }
}
