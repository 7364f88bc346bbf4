package org.calista.culturerank.score;

import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.ScoreBreakdown;
import org.calista.culturerank.model.ScoreWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores one candidate against the user's recent exposures.
 *
 * Implementations must be deterministic and side-effect free: the same inputs always yield a
 * bit-identical breakdown.
 */
public interface CandidateScorer {

    ScoreBreakdown score(Candidate candidate, ScoreWeights weights, Map<String, Integer> recentClusterExposures, long nowTs);

    /**
     * Batch hook. Must preserve the order of {@code candidates}.
     */
    default List<ScoredCandidate> scoreBatch(List<Candidate> candidates,
                                             ScoreWeights weights,
                                             Map<String, Integer> recentClusterExposures,
                                             long nowTs) {
        if (candidates == null || candidates.isEmpty()) return List.of();
        ArrayList<ScoredCandidate> out = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            out.add(new ScoredCandidate(c, score(c, weights, recentClusterExposures, nowTs)));
        }
        return out;
    }
}
