package com.allsets.plays;

/**
 * Totals of one aggregation run: summed plays and the number of unique sets, linked or not.
 */
public record RunTotals(long totalPlays, long totalSets) {}
