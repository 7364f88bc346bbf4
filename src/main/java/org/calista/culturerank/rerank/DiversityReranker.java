package org.calista.culturerank.rerank;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.model.ConstraintsReport;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.rerank.impl.DppReranker;
import org.calista.culturerank.rerank.impl.MmrReranker;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Chooses the rerank strategy for a call.
 *
 * DPP runs only when requested and N fits the kernel ceiling; everything else (including a
 * requested NONE) is served by MMR. N = 0 yields an empty result reported as NONE.
 */
public final class DiversityReranker {
    private static final Logger log = LogManager.getLogger(DiversityReranker.class);

    private final RerankStrategy mmr;
    private final RerankStrategy dpp;

    public DiversityReranker() {
        this(new MmrReranker(), new DppReranker());
    }

    public DiversityReranker(RerankStrategy mmr, RerankStrategy dpp) {
        this.mmr = Objects.requireNonNull(mmr, "mmr");
        this.dpp = Objects.requireNonNull(dpp, "dpp");
    }

    public RerankResult rerank(List<ScoredCandidate> ranked, RerankOptions options) {
        Objects.requireNonNull(options, "options");
        int available = ranked == null ? 0 : ranked.size();
        int n = Math.min(options.diversityCapN, available);

        if (n <= 0) {
            return RerankResult.empty(ConstraintsReport.none(options.effectiveClusterCap, options.effectiveExplorationBudget, options.effectiveWeights));
        }

        RerankStrategy strategy = select(options, n);
        RerankResult result = strategy.rerank(ranked, options);

        if (log.isDebugEnabled()) {
            log.debug("rerank: requested={} used={} N={} available={} report={} metrics={}",
                    options.strategy, strategy.kind(), n, available, result.report, DiversityMetrics.of(result.candidates()));
        }
        return result;
    }

    RerankStrategy select(RerankOptions options, int n) {
        if (options.strategy == DiversityStrategy.DPP) {
            if (n <= options.dppParams.maxKernelSize) return dpp;
            log.debug("dpp requested for N={} above kernel ceiling {}, using mmr", n, options.dppParams.maxKernelSize);
        }
        return mmr;
    }
}
