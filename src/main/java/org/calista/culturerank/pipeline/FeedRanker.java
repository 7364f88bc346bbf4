package org.calista.culturerank.pipeline;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.fingerprint.ParamFingerprint;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.RankRequest;
import org.calista.culturerank.model.RankResponse;
import org.calista.culturerank.model.RankedItem;
import org.calista.culturerank.model.UserState;
import org.calista.culturerank.policy.SurfacePolicy;
import org.calista.culturerank.policy.SurfacePolicyTable;
import org.calista.culturerank.rerank.DiversityReranker;
import org.calista.culturerank.rerank.RerankOptions;
import org.calista.culturerank.rerank.RerankResult;
import org.calista.culturerank.score.CandidateScorer;
import org.calista.culturerank.score.DiversitySlider;
import org.calista.culturerank.score.PrimaryRanker;
import org.calista.culturerank.score.ScoredCandidate;
import org.calista.culturerank.score.impl.CultureValueScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One full ranking call:
 * <ol>
 *   <li>validate the request</li>
 *   <li>resolve effective parameters (defaults + overrides)</li>
 *   <li>drop hard-blocked and policy-rejected candidates</li>
 *   <li>slider: effective weights, cluster cap and exploration budget</li>
 *   <li>primary scoring and sort, truncated to rerankMaxCandidates</li>
 *   <li>diversity rerank of the top N</li>
 *   <li>fingerprint and response</li>
 * </ol>
 *
 * Stateless between calls; safe to share across threads.
 */
public final class FeedRanker {
    private static final Logger log = LogManager.getLogger(FeedRanker.class);

    public static final String ALGORITHM_ID = "culture-rank";
    public static final String ALGORITHM_VERSION = "1.0.0";
    public static final String CONTRACT_VERSION = "1.0";

    private final RankParams defaults;
    private final PrimaryRanker primary;
    private final DiversitySlider slider;
    private final DiversityReranker reranker;
    private final SurfacePolicyTable policies;
    private final ParamFingerprint fingerprint;

    public FeedRanker() {
        this(RankParams.defaults(), SurfacePolicyTable.defaults(), ParamFingerprint.createDefault());
    }

    public FeedRanker(RankParams defaults, SurfacePolicyTable policies, ParamFingerprint fingerprint) {
        this(defaults, new CultureValueScorer(defaults.scoring), new DiversityReranker(), policies, fingerprint);
    }

    public FeedRanker(RankParams defaults,
                      CandidateScorer scorer,
                      DiversityReranker reranker,
                      SurfacePolicyTable policies,
                      ParamFingerprint fingerprint) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.primary = new PrimaryRanker(Objects.requireNonNull(scorer, "scorer"));
        this.slider = new DiversitySlider(defaults.slider);
        this.reranker = Objects.requireNonNull(reranker, "reranker");
        this.policies = Objects.requireNonNull(policies, "policies");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public RankParams defaults() {
        return defaults;
    }

    /**
     * @throws IllegalArgumentException when the request misses required structure
     */
    public RankResponse rank(RankRequest request) {
        Objects.requireNonNull(request, "request");
        request.validate();

        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("req", request.requestId)) {
            return rankValidated(request);
        }
    }

    private RankResponse rankValidated(RankRequest request) {
        RankParams params = defaults.withOverrides(request.params);
        UserState user = request.userState;
        Map<String, Integer> exposures = user.recentClusterExposures == null ? Map.of() : user.recentClusterExposures;

        SurfacePolicy policy = policies.forSurface(request.context.surface);
        ArrayList<Candidate> allowed = new ArrayList<>(request.candidates.size());
        int rejected = 0;
        for (Candidate c : request.candidates) {
            if (c.hardBlocked() || !policy.allows(c)) {
                rejected++;
                continue;
            }
            allowed.add(c);
        }

        DiversitySlider.Result tuned = slider.apply(params.weights, user.diversitySlider, params.diversityCapK, params.explorationBudget);

        List<ScoredCandidate> ranked = primary.rank(allowed, exposures, request.context.nowTs, tuned.weights);
        if (ranked.size() > params.rerankMaxCandidates) {
            ranked = ranked.subList(0, params.rerankMaxCandidates);
        }

        RerankOptions options = RerankOptions.builder()
                .diversityCapN(params.diversityCapN)
                .effectiveClusterCap(tuned.effectiveClusterCap)
                .effectiveExplorationBudget(tuned.effectiveExplorationBudget)
                .mmrSimilarityPenalty(params.mmrSimilarityPenalty)
                .requestSeed(request.seedString())
                .recentClusterExposures(exposures)
                .explainThresholds(params.explain)
                .newClusterExposureMax(params.newClusterExposureMax)
                .strategy(params.rerankStrategy)
                .dppParams(params.dpp)
                .effectiveWeights(tuned.weights)
                .build();

        RerankResult result = reranker.rerank(ranked, options);

        ArrayList<RankedItem> items = new ArrayList<>(result.picks.size());
        for (RerankResult.Pick p : result.picks) {
            Candidate c = p.scored().candidate;
            items.add(new RankedItem(c.itemKey, c.type, c.clusterId, p.scored().finalScore(), p.reasonCodes(), p.scored().score));
        }

        String variantId = request.params == null ? null : request.params.variantId;
        RankResponse response = new RankResponse(
                request.requestId,
                ALGORITHM_ID,
                ALGORITHM_VERSION,
                CONTRACT_VERSION,
                fingerprint.fingerprint(params),
                variantId,
                items,
                result.report
        );

        if (log.isDebugEnabled()) {
            log.debug("rank requestId={} surface={} in={} rejected={} ranked={} strategy={} capApplied={}",
                    request.requestId, request.context.surface, request.candidates.size(), rejected,
                    items.size(), result.report.usedStrategy, result.report.capAppliedCount);
        }
        return response;
    }
}
