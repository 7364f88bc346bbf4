package org.calista.culturerank.explain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thresholds for reason-code rules. Caller-overridable through {@code RankConfig}.
 */
public final class ExplainThresholds {

    public static final ExplainThresholds DEFAULT = new ExplainThresholds(0.70, 0.70, 0.15, 2, 0.65);

    public final double contextHigh;
    public final double bridgeHigh;
    public final double supportDensityHigh;

    /** NEW_IN_CLUSTER fires while the recent exposure count is strictly below this limit. */
    public final int newClusterExposureLimit;

    public final double prsSimilarityMin;

    @JsonCreator
    public ExplainThresholds(@JsonProperty("contextHigh") double contextHigh,
                             @JsonProperty("bridgeHigh") double bridgeHigh,
                             @JsonProperty("supportDensityHigh") double supportDensityHigh,
                             @JsonProperty("newClusterExposureLimit") int newClusterExposureLimit,
                             @JsonProperty("prsSimilarityMin") double prsSimilarityMin) {
        this.contextHigh = contextHigh;
        this.bridgeHigh = bridgeHigh;
        this.supportDensityHigh = supportDensityHigh;
        this.newClusterExposureLimit = newClusterExposureLimit;
        this.prsSimilarityMin = prsSimilarityMin;
    }

    @Override
    public String toString() {
        return "ExplainThresholds{context>=" + contextHigh + ", bridge>=" + bridgeHigh
                + ", density>=" + supportDensityHigh + ", exposure<" + newClusterExposureLimit
                + ", prs>=" + prsSimilarityMin + '}';
    }
}
