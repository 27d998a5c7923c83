package com.allsets.plays;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Interface for the plays aggregation pass.
 */
public interface AggregationServiceInterface {
    /**
     * Resolves and prints every entry in order, then the two summary lines.
     * @param entries Parsed, deduplicated entries
     * @param out Destination of the rewritten list
     * @return Totals of the run
     */
    RunTotals aggregate(List<SetEntry> entries, PrintStream out);

    /**
     * Resolves the summed play count of a single linked set.
     * @param entry Linked entry
     * @return Total plays across providers
     * @throws IOException if the set page cannot be fetched
     */
    long resolvePlays(SetEntry entry) throws IOException;
}
