package org.calista.culturerank.model;

/**
 * Reranking strategy. NONE is only ever reported, for calls that had nothing to rerank.
 */
public enum DiversityStrategy {
    MMR,
    DPP,
    NONE
}
