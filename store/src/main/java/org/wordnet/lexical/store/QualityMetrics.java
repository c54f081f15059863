package org.wordnet.lexical.store;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QualityMetrics {
    long synsetsWithIli;
    long synsetsWithoutIli;
    /** Share of synsets linked to the ILI, 0 to 100. */
    double iliCoveragePercentage;
    /** Synsets without member senses. */
    long emptySynsets;
    long synsetsWithDefinitions;
    long synsetsWithoutDefinitions;
}
