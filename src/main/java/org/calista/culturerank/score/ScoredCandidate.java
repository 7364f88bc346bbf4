package org.calista.culturerank.score;

import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.ScoreBreakdown;

import java.util.Comparator;
import java.util.Objects;

/**
 * Candidate paired with its breakdown for the current call.
 *
 * Natural order is the primary ranking order: finalScore desc, createdAt desc, itemKey asc.
 * ItemKeys are unique per request, so the order is total and independent of sort stability.
 */
public final class ScoredCandidate implements Comparable<ScoredCandidate> {

    public static final Comparator<ScoredCandidate> RANKING_ORDER = Comparator.naturalOrder();

    public final Candidate candidate;
    public final ScoreBreakdown score;

    public ScoredCandidate(Candidate candidate, ScoreBreakdown score) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.score = Objects.requireNonNull(score, "score");
    }

    public double finalScore() {
        return score.finalScore;
    }

    public String itemKey() {
        return candidate.itemKey;
    }

    public String clusterId() {
        return candidate.clusterId;
    }

    @Override
    public int compareTo(ScoredCandidate o) {
        int c = Double.compare(o.score.finalScore, this.score.finalScore);
        if (c != 0) return c;
        c = Long.compare(o.candidate.createdAt, this.candidate.createdAt);
        if (c != 0) return c;
        return this.candidate.itemKey.compareTo(o.candidate.itemKey);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ScoredCandidate s)) return false;
        return Objects.equals(candidate.itemKey, s.candidate.itemKey)
                && Double.doubleToLongBits(score.finalScore) == Double.doubleToLongBits(s.score.finalScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate.itemKey, Double.doubleToLongBits(score.finalScore));
    }

    @Override
    public String toString() {
        return "ScoredCandidate{" + candidate.itemKey + ", score=" + score.finalScore + '}';
    }
}
