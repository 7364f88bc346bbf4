package org.calista.culturerank.score;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.ScoreWeights;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * First pass: drop hard-blocked candidates, score the rest and apply the total ranking order.
 */
public final class PrimaryRanker {
    private static final Logger log = LogManager.getLogger(PrimaryRanker.class);

    private final CandidateScorer scorer;

    public PrimaryRanker(CandidateScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public List<ScoredCandidate> rank(List<Candidate> candidates,
                                      Map<String, Integer> recentClusterExposures,
                                      long nowTs,
                                      ScoreWeights weights) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        ArrayList<Candidate> eligible = new ArrayList<>(candidates.size());
        int blocked = 0;
        for (Candidate c : candidates) {
            if (c.hardBlocked()) {
                blocked++;
                continue;
            }
            eligible.add(c);
        }

        ArrayList<ScoredCandidate> scored = new ArrayList<>(scorer.scoreBatch(eligible, weights, recentClusterExposures, nowTs));
        scored.sort(ScoredCandidate.RANKING_ORDER);

        if (log.isDebugEnabled()) {
            log.debug("primary rank: in={} hardBlocked={} scored={}", candidates.size(), blocked, scored.size());
        }
        return scored;
    }
}
