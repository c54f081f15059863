package org.wordnet.lexical.store;

import lombok.Builder;
import lombok.Value;

/**
 * Entity totals over a set of lexicons.
 */
@Value
@Builder
public class StoreStatistics {
    long totalWords;
    long totalSynsets;
    long totalSenses;
    /** All ILI entries for the whole store, referenced ones for a subset. */
    long totalIlis;
    long totalLexicons;
}
