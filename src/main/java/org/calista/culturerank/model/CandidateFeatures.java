package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Feature record produced by upstream collaborators. The ranking core reads these values and
 * never recomputes them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CandidateFeatures {

    public CvsComponents cvsComponents;

    /** Personal relevance score; absent means 0. */
    public Double prs;

    public PrsSource prsSource;

    /** Optional embedding; similarity falls back to cluster identity without it. */
    public double[] embedding;

    /** Explicit support-density hint. When absent it may be derived from like signal and viewers. */
    public Double supportDensity;

    /** Qualified (fraud-filtered) unique viewers. */
    public Integer qualifiedUniqueViewers;

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
