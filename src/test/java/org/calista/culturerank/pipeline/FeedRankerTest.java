package org.calista.culturerank.pipeline;

import org.calista.culturerank.Fixtures;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ParamOverrides;
import org.calista.culturerank.model.RankRequest;
import org.calista.culturerank.model.RankResponse;
import org.calista.culturerank.model.RankedItem;
import org.calista.culturerank.model.ReasonCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FeedRanker")
class FeedRankerTest {

    private final FeedRanker ranker = new FeedRanker();

    private static List<Candidate> twenty() {
        final ArrayList<Candidate> out = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            out.add(Fixtures.candidate(String.format("item-%02d", i), "c" + (i % 6), 0.2 + 0.03 * ((i * 7) % 20), Fixtures.NOW - i * 3_600_000L));
        }
        return out;
    }

    private static List<String> keys(RankResponse r) {
        return r.ranked.stream().map(i -> i.itemKey).toList();
    }

    @Test
    @DisplayName("hard-blocked candidate never reaches the output")
    void shouldRemoveHardBlockedCandidate() {
        final RankRequest req = Fixtures.request("req-a", List.of(
                Fixtures.hardBlocked(Fixtures.candidate("blocked", "c1", 1.0, Fixtures.NOW)),
                Fixtures.candidate("normal", "c2")));

        final RankResponse r = ranker.rank(req);

        assertThat(keys(r)).containsExactly("normal");
    }

    @Test
    @DisplayName("empty candidate list gives an empty NONE result")
    void shouldGiveEmptyResultForEmptyCandidates() {
        final RankResponse r = ranker.rank(Fixtures.request("req-b", List.of()));

        assertThat(r.ranked).isEmpty();
        assertThat(r.constraintsReport.usedStrategy).isEqualTo(DiversityStrategy.NONE);
        assertThat(r.paramSetId).isNotBlank();
    }

    @Test
    @DisplayName("single cluster with K=1 still returns items and counts the cap")
    void shouldReturnItemsAndCountCapForSingleClusterWithTightCap() {
        final RankRequest req = Fixtures.request("req-c", List.of(
                Fixtures.candidate("a", "c1", 0.9, Fixtures.NOW),
                Fixtures.candidate("b", "c1", 0.8, Fixtures.NOW),
                Fixtures.candidate("c", "c1", 0.7, Fixtures.NOW)));
        req.params = new ParamOverrides();
        req.params.diversityCapK = 1;
        req.params.diversityCapN = 3;

        final RankResponse r = ranker.rank(req);

        assertThat(r.ranked).isNotEmpty();
        assertThat(r.constraintsReport.capAppliedCount).isGreaterThan(0);
    }

    @Test
    @DisplayName("fixed seed gives identical order across calls")
    void shouldReproduceOrderWithFixedSeed() {
        final RankRequest first = Fixtures.request("req-d", twenty());
        first.requestSeed = "fixed-seed-123";
        first.params = new ParamOverrides();
        first.params.explorationBudget = 0.3;

        final RankRequest second = Fixtures.request("req-d", twenty());
        second.requestSeed = "fixed-seed-123";
        second.params = new ParamOverrides();
        second.params.explorationBudget = 0.3;

        final RankResponse a = ranker.rank(first);
        final RankResponse b = ranker.rank(second);

        assertThat(keys(a)).isEqualTo(keys(b));
        assertThat(a.ranked).extracting(i -> i.finalScore).isEqualTo(b.ranked.stream().map(i -> i.finalScore).toList());
        assertThat(a.paramSetId).isEqualTo(b.paramSetId);
        assertThat(a.constraintsReport.explorationSlotsRequested).isEqualTo(b.constraintsReport.explorationSlotsRequested);
    }

    @Test
    void shouldBoundOutputByTargetSizeWithDistinctKeys() {
        final RankRequest req = Fixtures.request("req-size", twenty());
        req.params = new ParamOverrides();
        req.params.diversityCapN = 7;

        final RankResponse r = ranker.rank(req);

        assertThat(r.ranked).hasSize(7);
        assertThat(keys(r)).doesNotHaveDuplicates();
        assertThat(r.ranked).allSatisfy(i -> assertThat(i.reasonCodes).isNotEmpty().doesNotContain(ReasonCode.EDITORIAL));
    }

    @Test
    void shouldGiveEmptyNoneResultForZeroTargetSize() {
        final RankRequest req = Fixtures.request("req-n0", twenty());
        req.params = new ParamOverrides();
        req.params.diversityCapN = 0;

        final RankResponse r = ranker.rank(req);

        assertThat(r.ranked).isEmpty();
        assertThat(r.constraintsReport.usedStrategy).isEqualTo(DiversityStrategy.NONE);
    }

    @Test
    void shouldFilterUnmoderatedCandidatesByDefault() {
        final Candidate raw = Fixtures.candidate("raw", "c1", 1.0, Fixtures.NOW);
        raw.qualityFlags.moderated = false;

        final RankResponse r = ranker.rank(Fixtures.request("req-mod", List.of(raw, Fixtures.candidate("ok", "c2"))));

        assertThat(keys(r)).containsExactly("ok");
    }

    @Test
    void shouldRoundScoresToNineDigits() {
        final RankResponse r = ranker.rank(Fixtures.request("req-round", twenty()));

        for (RankedItem i : r.ranked) {
            assertThat(i.finalScore * 1e9).isCloseTo(Math.rint(i.finalScore * 1e9), within(1e-3));
            assertThat(i.scoreBreakdown.finalScore).isEqualTo(i.finalScore);
        }
    }

    @Test
    void shouldKeepEffectiveWeightsSummingToOne() {
        for (double t : new double[]{0.0, 0.13, 0.5, 0.77, 1.0}) {
            final RankRequest req = Fixtures.request("req-w", twenty());
            req.userState.diversitySlider = t;

            final RankResponse r = ranker.rank(req);

            assertThat(r.constraintsReport.effectiveWeights.sum()).isCloseTo(1.0, within(1e-5));
        }
    }

    @Test
    void shouldCarryAlgorithmIdentityAndVariant() {
        final RankRequest req = Fixtures.request("req-id", List.of(Fixtures.candidate("a", "c1")));
        req.params = new ParamOverrides();
        req.params.variantId = "B";

        final RankResponse r = ranker.rank(req);

        assertThat(r.requestId).isEqualTo("req-id");
        assertThat(r.algorithmId).isEqualTo("culture-rank");
        assertThat(r.algorithmVersion).isEqualTo("1.0.0");
        assertThat(r.contractVersion).isEqualTo("1.0");
        assertThat(r.variantId).isEqualTo("B");
    }

    @Test
    void shouldGiveDifferentParamSetIdsForDifferentParams() {
        final RankRequest a = Fixtures.request("req-p", List.of(Fixtures.candidate("a", "c1")));
        final RankRequest b = Fixtures.request("req-p", List.of(Fixtures.candidate("a", "c1")));
        b.params = new ParamOverrides();
        b.params.diversityCapN = 5;

        assertThat(ranker.rank(a).paramSetId).isNotEqualTo(ranker.rank(b).paramSetId);
    }

    @Test
    void shouldRunDppWhenRequestedPerCall() {
        final RankRequest req = Fixtures.request("req-dpp", twenty());
        req.params = new ParamOverrides();
        req.params.rerankStrategy = DiversityStrategy.DPP;
        req.params.diversityCapN = 6;

        final RankResponse r = ranker.rank(req);

        assertThat(r.constraintsReport.usedStrategy).isEqualTo(DiversityStrategy.DPP);
        assertThat(r.ranked).hasSizeLessThanOrEqualTo(6).isNotEmpty();
        assertThat(r.constraintsReport.explorationSlotsRequested).isZero();
    }

    @Test
    void shouldTruncateRerankPoolToMaxCandidates() {
        final RankRequest req = Fixtures.request("req-max", twenty());
        req.params = new ParamOverrides();
        req.params.rerankMaxCandidates = 3;

        assertThat(ranker.rank(req).ranked).hasSize(3);
    }

    @Test
    void shouldRejectMalformedCandidate() {
        final Candidate broken = Fixtures.candidate("broken", "c1");
        broken.features = null;

        assertThatThrownBy(() -> ranker.rank(Fixtures.request("req-bad", List.of(broken))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("features");
    }

    @Test
    void shouldRejectDuplicateItemKeys() {
        assertThatThrownBy(() -> ranker.rank(Fixtures.request("req-dup", List.of(
                Fixtures.candidate("same", "c1"),
                Fixtures.candidate("same", "c2")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same");
    }
}
