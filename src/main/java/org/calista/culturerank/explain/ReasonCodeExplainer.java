package org.calista.culturerank.explain;

import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.CandidateFeatures;
import org.calista.culturerank.model.ReasonCode;
import org.calista.culturerank.model.UserState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Derives reason codes from a candidate's features. Every applicable rule fires, in a fixed order:
 * <ol>
 *   <li>GROWING_CONTEXT</li>
 *   <li>BRIDGE_SUCCESS</li>
 *   <li>HIGH_SUPPORT_DENSITY</li>
 *   <li>NEW_IN_CLUSTER</li>
 *   <li>SIMILAR_TO_LIKED / FOLLOWING / SIMILAR_TO_SAVED</li>
 *   <li>TRENDING_IN_CLUSTER when nothing above fired</li>
 * </ol>
 * DIVERSITY_SLOT / EXPLORATION are attached by the reranker, see {@link #merge}.
 */
public final class ReasonCodeExplainer {

    /** Priors of the derived support density: (like + PRIOR_LIKES) / (viewers + PRIOR_VIEWS). */
    static final double PRIOR_LIKES = 1.0;
    static final double PRIOR_VIEWS = 10.0;

    private ReasonCodeExplainer() {}

    public static List<ReasonCode> explain(Candidate candidate, Map<String, Integer> recentClusterExposures) {
        return explain(candidate, recentClusterExposures, ExplainThresholds.DEFAULT);
    }

    public static List<ReasonCode> explain(Candidate candidate,
                                           Map<String, Integer> recentClusterExposures,
                                           ExplainThresholds thresholds) {
        ExplainThresholds th = thresholds == null ? ExplainThresholds.DEFAULT : thresholds;
        CandidateFeatures f = candidate.features;
        ArrayList<ReasonCode> codes = new ArrayList<>(4);

        if (f.cvsComponents.context >= th.contextHigh) codes.add(ReasonCode.GROWING_CONTEXT);
        if (f.cvsComponents.bridge >= th.bridgeHigh) codes.add(ReasonCode.BRIDGE_SUCCESS);

        Double density = supportDensity(f);
        if (density != null && density >= th.supportDensityHigh) codes.add(ReasonCode.HIGH_SUPPORT_DENSITY);

        if (UserState.exposureOf(recentClusterExposures, candidate.clusterId) < th.newClusterExposureLimit) {
            codes.add(ReasonCode.NEW_IN_CLUSTER);
        }

        if (f.prs != null && f.prs >= th.prsSimilarityMin && f.prsSource != null) {
            switch (f.prsSource) {
                case LIKED -> codes.add(ReasonCode.SIMILAR_TO_LIKED);
                case FOLLOWING -> codes.add(ReasonCode.FOLLOWING);
                case SAVED -> codes.add(ReasonCode.SIMILAR_TO_SAVED);
            }
        }

        if (codes.isEmpty()) codes.add(ReasonCode.TRENDING_IN_CLUSTER);
        return codes;
    }

    /**
     * Explicit hint when present, otherwise derived from the like signal and qualified viewers.
     * Null when neither is available.
     */
    public static Double supportDensity(CandidateFeatures f) {
        if (f.supportDensity != null && Double.isFinite(f.supportDensity)) return f.supportDensity;
        if (f.qualifiedUniqueViewers == null || f.cvsComponents == null) return null;

        double viewers = Math.max(0, f.qualifiedUniqueViewers);
        double like = Double.isFinite(f.cvsComponents.like) ? Math.max(0.0, f.cvsComponents.like) : 0.0;
        return (like + PRIOR_LIKES) / (viewers + PRIOR_VIEWS);
    }

    /** Ordered union without duplicates; {@code head} codes come first. */
    public static List<ReasonCode> merge(Collection<ReasonCode> head, Collection<ReasonCode> tail) {
        LinkedHashSet<ReasonCode> out = new LinkedHashSet<>();
        if (head != null) out.addAll(head);
        if (tail != null) out.addAll(tail);
        return List.copyOf(out);
    }
}
