package org.calista.culturerank.pipeline;

import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ParamOverrides;
import org.calista.culturerank.model.ScoreWeights;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RankParamsTest {

    @Test
    void shouldMatchDocumentedDefaults() {
        final RankParams p = RankParams.defaults();

        assertThat(p.weights).isEqualTo(ScoreWeights.of(0.55, 0.25, 0.20));
        assertThat(p.diversityCapN).isEqualTo(20);
        assertThat(p.diversityCapK).isEqualTo(5);
        assertThat(p.explorationBudget).isEqualTo(0.15);
        assertThat(p.mmrSimilarityPenalty).isEqualTo(0.3);
        assertThat(p.rerankMaxCandidates).isEqualTo(200);
        assertThat(p.rerankStrategy).isEqualTo(DiversityStrategy.MMR);
    }

    @Test
    void shouldReturnSameParamsForNullOverrides() {
        final RankParams p = RankParams.defaults();
        assertThat(p.withOverrides(null)).isSameAs(p);
    }

    @Test
    void shouldApplyAndClampOverrides() {
        final ParamOverrides o = new ParamOverrides();
        o.diversityCapN = -3;
        o.diversityCapK = 0;
        o.explorationBudget = 4.0;
        o.rerankMaxCandidates = 0;
        o.mmrSimilarityPenalty = Double.NaN;
        o.rerankStrategy = DiversityStrategy.DPP;

        final RankParams p = RankParams.defaults().withOverrides(o);

        assertThat(p.diversityCapN).isZero();
        assertThat(p.diversityCapK).isEqualTo(1);
        assertThat(p.explorationBudget).isEqualTo(1.0);
        assertThat(p.rerankMaxCandidates).isEqualTo(1);
        assertThat(p.mmrSimilarityPenalty).isEqualTo(0.3);
        assertThat(p.rerankStrategy).isEqualTo(DiversityStrategy.DPP);
    }

    @Test
    void shouldIgnoreNonFiniteWeightOverride() {
        final ParamOverrides o = new ParamOverrides();
        o.weights = ScoreWeights.of(Double.NaN, 0.5, 0.5);

        assertThat(RankParams.defaults().withOverrides(o).weights).isEqualTo(RankParams.DEFAULT_WEIGHTS);
    }
}
