package org.calista.culturerank;

import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.CandidateFeatures;
import org.calista.culturerank.model.CvsComponents;
import org.calista.culturerank.model.PrsSource;
import org.calista.culturerank.model.QualityFlags;
import org.calista.culturerank.model.RankContext;
import org.calista.culturerank.model.RankRequest;
import org.calista.culturerank.model.ScoreBreakdown;
import org.calista.culturerank.model.UserState;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders shared by tests.
 */
public final class Fixtures {

    public static final long NOW = 1_700_000_000_000L;

    private Fixtures() {}

    public static Candidate candidate(String itemKey, String clusterId) {
        return candidate(itemKey, clusterId, 0.5, NOW);
    }

    public static Candidate candidate(String itemKey, String clusterId, double prs, long createdAt) {
        Candidate c = new Candidate();
        c.itemKey = itemKey;
        c.clusterId = clusterId;
        c.createdAt = createdAt;
        c.qualityFlags = QualityFlags.moderatedOnly();
        c.features = new CandidateFeatures();
        c.features.cvsComponents = CvsComponents.of(0.5, 0.5, 0.5, 0.5, 0.5);
        c.features.prs = prs;
        return c;
    }

    public static Candidate withSource(Candidate c, PrsSource source) {
        c.features.prsSource = source;
        return c;
    }

    public static Candidate hardBlocked(Candidate c) {
        c.qualityFlags.hardBlock = true;
        return c;
    }

    public static Candidate withEmbedding(Candidate c, double... embedding) {
        c.features.embedding = embedding;
        return c;
    }

    /** Scored candidate with a fixed breakdown; dns and final score are given directly. */
    public static ScoredCandidate scored(String itemKey, String clusterId, double finalScore, double dns) {
        return new ScoredCandidate(candidate(itemKey, clusterId), new ScoreBreakdown(0.5, 0.5, dns, 0.0, finalScore));
    }

    public static RankRequest request(String requestId, List<Candidate> candidates) {
        RankRequest r = new RankRequest();
        r.contractVersion = "1.0";
        r.requestId = requestId;
        r.userState = new UserState();
        r.userState.userKey = "user-1";
        r.context = new RankContext();
        r.context.nowTs = NOW;
        r.candidates = new ArrayList<>(candidates);
        return r;
    }

    public static Map<String, Integer> exposures(Object... clusterAndCount) {
        HashMap<String, Integer> m = new HashMap<>();
        for (int i = 0; i + 1 < clusterAndCount.length; i += 2) {
            m.put((String) clusterAndCount[i], (Integer) clusterAndCount[i + 1]);
        }
        return m;
    }
}
