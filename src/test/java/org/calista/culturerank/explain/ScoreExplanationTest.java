package org.calista.culturerank.explain;

import org.calista.culturerank.model.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreExplanationTest {

    @Test
    void shouldNameTheDominantFactor() {
        final ScoreExplanation e = ScoreExplanation.of(new ScoreBreakdown(0.2, 0.7, 0.4, 0.0, 0.5));

        assertThat(e.summary).isEqualTo("Cultural value is the main factor.");
        assertThat(e.factors).extracting(ScoreExplanation.Factor::name).containsExactly("PRS", "CVS", "DNS");
    }

    @Test
    void shouldShowPenaltyAsNegativeFactor() {
        final ScoreExplanation e = ScoreExplanation.of(new ScoreBreakdown(0.1, 0.1, 0.1, 0.5, -0.4));

        assertThat(e.factors).hasSize(4);
        assertThat(e.factors.get(3).value()).isEqualTo(-0.5);
        assertThat(e.summary).isEqualTo("Quality penalties is the main factor.");
    }

    @Test
    void shouldExpressContributionRatesAsPercentagesOfComponentSum() {
        final ScoreExplanation.ContributionRates r = ScoreExplanation.contributionRates(new ScoreBreakdown(0.5, 0.3, 0.2, 0.0, 0.0));
        assertThat(r).isEqualTo(new ScoreExplanation.ContributionRates(50, 30, 20));
    }

    @Test
    void shouldGiveZeroRatesForZeroTotal() {
        final ScoreExplanation.ContributionRates r = ScoreExplanation.contributionRates(new ScoreBreakdown(0, 0, 0, 0, 0));
        assertThat(r).isEqualTo(new ScoreExplanation.ContributionRates(0, 0, 0));
    }
}
