package org.calista.culturerank.rerank;

import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.List;

/**
 * Reorders the head of a primary-ranked list under diversity constraints.
 *
 * Input must already be in ranking order (finalScore desc, createdAt desc, itemKey asc).
 * Implementations return at most min(diversityCapN, ranked.size()) distinct picks, each with at
 * least one reason code, and are fully deterministic for a given seed.
 */
public interface RerankStrategy {

    DiversityStrategy kind();

    RerankResult rerank(List<ScoredCandidate> ranked, RerankOptions options);
}
