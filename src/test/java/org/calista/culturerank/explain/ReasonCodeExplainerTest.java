package org.calista.culturerank.explain;

import org.calista.culturerank.Fixtures;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.CvsComponents;
import org.calista.culturerank.model.PrsSource;
import org.calista.culturerank.model.ReasonCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReasonCodeExplainerTest {

    @Test
    void shouldFireAllApplicableRulesInFixedOrder() {
        final Candidate c = Fixtures.withSource(Fixtures.candidate("a", "c1", 0.9, Fixtures.NOW), PrsSource.LIKED);
        c.features.cvsComponents = CvsComponents.of(0.5, 0.8, 0.5, 0.75, 0.5);
        c.features.supportDensity = 0.2;

        final List<ReasonCode> codes = ReasonCodeExplainer.explain(c, Map.of());

        assertThat(codes).containsExactly(
                ReasonCode.GROWING_CONTEXT,
                ReasonCode.BRIDGE_SUCCESS,
                ReasonCode.HIGH_SUPPORT_DENSITY,
                ReasonCode.NEW_IN_CLUSTER,
                ReasonCode.SIMILAR_TO_LIKED);
    }

    @Test
    void shouldFallBackToTrendingWhenNothingElseFires() {
        final Candidate c = Fixtures.candidate("a", "c1", 0.1, Fixtures.NOW);

        final List<ReasonCode> codes = ReasonCodeExplainer.explain(c, Fixtures.exposures("c1", 9));

        assertThat(codes).containsExactly(ReasonCode.TRENDING_IN_CLUSTER);
    }

    @Test
    void shouldTieNewInClusterToExposureLimit() {
        final Candidate c = Fixtures.candidate("a", "c1", 0.1, Fixtures.NOW);
        assertThat(ReasonCodeExplainer.explain(c, Fixtures.exposures("c1", 1))).containsExactly(ReasonCode.NEW_IN_CLUSTER);
        assertThat(ReasonCodeExplainer.explain(c, Fixtures.exposures("c1", 2))).containsExactly(ReasonCode.TRENDING_IN_CLUSTER);
    }

    @Test
    void shouldSelectExactlyOneCodeFromRelevanceSource() {
        final Map<String, Integer> seen = Fixtures.exposures("c1", 5);
        assertThat(ReasonCodeExplainer.explain(Fixtures.withSource(Fixtures.candidate("a", "c1", 0.7, Fixtures.NOW), PrsSource.FOLLOWING), seen))
                .containsExactly(ReasonCode.FOLLOWING);
        assertThat(ReasonCodeExplainer.explain(Fixtures.withSource(Fixtures.candidate("a", "c1", 0.7, Fixtures.NOW), PrsSource.SAVED), seen))
                .containsExactly(ReasonCode.SIMILAR_TO_SAVED);
        // below the relevance threshold the source is ignored
        assertThat(ReasonCodeExplainer.explain(Fixtures.withSource(Fixtures.candidate("a", "c1", 0.6, Fixtures.NOW), PrsSource.SAVED), seen))
                .containsExactly(ReasonCode.TRENDING_IN_CLUSTER);
    }

    @Test
    void shouldHonorOverriddenThresholds() {
        final Candidate c = Fixtures.candidate("a", "c1", 0.1, Fixtures.NOW);
        final ExplainThresholds loose = new ExplainThresholds(0.4, 0.4, 0.15, 0, 0.65);

        assertThat(ReasonCodeExplainer.explain(c, Map.of(), loose))
                .containsExactly(ReasonCode.GROWING_CONTEXT, ReasonCode.BRIDGE_SUCCESS);
    }

    @Test
    void shouldDeriveSupportDensityFromViewersWithoutHint() {
        final Candidate c = Fixtures.candidate("a", "c1");
        assertThat(ReasonCodeExplainer.supportDensity(c.features)).isNull();

        c.features.cvsComponents.like = 0.9;
        c.features.qualifiedUniqueViewers = 2;
        // (0.9 + 1) / (2 + 10)
        assertThat(ReasonCodeExplainer.supportDensity(c.features)).isCloseTo(1.9 / 12.0, within(1e-12));
        assertThat(ReasonCodeExplainer.explain(c, Fixtures.exposures("c1", 9))).containsExactly(ReasonCode.HIGH_SUPPORT_DENSITY);

        c.features.supportDensity = 0.01;
        assertThat(ReasonCodeExplainer.supportDensity(c.features)).isEqualTo(0.01);
    }

    @Test
    void shouldKeepHeadFirstAndDropDuplicatesOnMerge() {
        final List<ReasonCode> merged = ReasonCodeExplainer.merge(
                List.of(ReasonCode.EXPLORATION, ReasonCode.DIVERSITY_SLOT),
                List.of(ReasonCode.NEW_IN_CLUSTER, ReasonCode.EXPLORATION));

        assertThat(merged).containsExactly(ReasonCode.EXPLORATION, ReasonCode.DIVERSITY_SLOT, ReasonCode.NEW_IN_CLUSTER);
    }
}
