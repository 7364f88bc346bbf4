package org.calista.culturerank.score.impl;

import org.calista.culturerank.math.Numerics;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.CvsComponents;
import org.calista.culturerank.model.ScoreBreakdown;
import org.calista.culturerank.model.ScoreWeights;
import org.calista.culturerank.model.UserState;
import org.calista.culturerank.score.CandidateScorer;
import org.calista.culturerank.score.CvsWeights;
import org.calista.culturerank.score.ScoringParams;

import java.util.Map;
import java.util.Objects;

/**
 * PRS / CVS / DNS blend:
 * <pre>
 *   CVS   = clamp01(sum w_i * component_i)
 *   DNS   = clamp01(0.6 * 1/(1 + exposure*factor) + 0.4 * exp(-ln2 * ageHours / halfLife))
 *   final = round9(w_prs*PRS + w_cvs*CVS + w_dns*DNS - penalty)
 * </pre>
 */
public final class CultureValueScorer implements CandidateScorer {

    private static final double MS_PER_HOUR = 3_600_000.0;
    private static final double MIN_HALF_LIFE_HOURS = 1e-6;

    private final ScoringParams params;

    public CultureValueScorer() {
        this(ScoringParams.defaults());
    }

    public CultureValueScorer(ScoringParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public ScoringParams params() {
        return params;
    }

    @Override
    public ScoreBreakdown score(Candidate candidate, ScoreWeights weights, Map<String, Integer> recentClusterExposures, long nowTs) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(weights, "weights");

        Double rawPrs = candidate.features.prs;
        double prs = Numerics.clamp01(rawPrs == null ? 0.0 : rawPrs);
        double cvs = cvs(candidate.features.cvsComponents);
        double dns = dns(candidate, recentClusterExposures, nowTs);
        double penalty = penalty(candidate);

        double raw = weights.prs * prs + weights.cvs * cvs + weights.dns * dns - penalty;
        double finalScore = Numerics.round9(Numerics.finiteOr(raw, 0.0));

        return new ScoreBreakdown(prs, cvs, dns, penalty, finalScore);
    }

    public double cvs(CvsComponents c) {
        if (c == null) return 0.0;
        CvsWeights w = params.cvsWeights;
        double v = w.like * c.like
                + w.context * c.context
                + w.collection * c.collection
                + w.bridge * c.bridge
                + w.sustain * c.sustain;
        return Numerics.clamp01(Numerics.finiteOr(v, 0.0));
    }

    public double dns(Candidate candidate, Map<String, Integer> recentClusterExposures, long nowTs) {
        int exposure = UserState.exposureOf(recentClusterExposures, candidate.clusterId);
        double clusterNovelty = 1.0 / (1.0 + exposure * params.clusterNoveltyFactor);

        // future timestamps behave as age 0
        double ageHours = Math.max(0.0, (nowTs - candidate.createdAt) / MS_PER_HOUR);
        double halfLife = Math.max(MIN_HALF_LIFE_HOURS, params.timeHalfLifeHours);
        double timeNovelty = Math.exp(-Numerics.LN2 * ageHours / halfLife);

        double v = params.dnsClusterNoveltyWeight * clusterNovelty + params.dnsTimeNoveltyWeight * timeNovelty;
        return Numerics.clamp01(Numerics.finiteOr(v, 0.0));
    }

    public double penalty(Candidate candidate) {
        double p = 0.0;
        if (candidate.qualityFlags != null && candidate.qualityFlags.spamSuspect) p += params.spamPenalty;
        return Numerics.clamp01(p);
    }
}
