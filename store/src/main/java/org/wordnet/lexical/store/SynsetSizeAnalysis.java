package org.wordnet.lexical.store;

import java.util.SortedMap;

import lombok.Value;

/**
 * Member counts of the synsets that have members. Empty synsets are reported
 * by {@link QualityMetrics#getEmptySynsets()} instead.
 */
@Value
public class SynsetSizeAnalysis {
    double averageSize;
    int maxSize;
    int minSize;
    /** Number of synsets of each size. */
    SortedMap<Integer, Long> sizeDistribution;
}
