package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Optional per-request parameter overrides. Null means "use the configured default".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParamOverrides {
    public Integer diversityCapN;
    public Integer diversityCapK;
    public Double explorationBudget;
    public ScoreWeights weights;
    public Double mmrSimilarityPenalty;
    public Integer rerankMaxCandidates;
    public DiversityStrategy rerankStrategy;
    public String variantId;
}
