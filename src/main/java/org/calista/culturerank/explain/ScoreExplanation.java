package org.calista.culturerank.explain;

import org.calista.culturerank.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Debug view of a score: factor list, dominant factor and contribution percentages.
 */
public final class ScoreExplanation {

    public final String summary;
    public final List<Factor> factors;
    public final ContributionRates contributions;

    private ScoreExplanation(String summary, List<Factor> factors, ContributionRates contributions) {
        this.summary = summary;
        this.factors = List.copyOf(factors);
        this.contributions = contributions;
    }

    public static ScoreExplanation of(ScoreBreakdown b) {
        ArrayList<Factor> factors = new ArrayList<>(4);
        factors.add(new Factor("PRS", b.prs, "Personal relevance"));
        factors.add(new Factor("CVS", b.cvs, "Cultural value"));
        factors.add(new Factor("DNS", b.dns, "Diversity/novelty"));
        if (b.penalty > 0.0) factors.add(new Factor("Penalty", -b.penalty, "Quality penalties"));

        Factor main = factors.get(0);
        for (Factor f : factors) {
            if (Math.abs(f.value) > Math.abs(main.value)) main = f;
        }

        return new ScoreExplanation(main.description + " is the main factor.", factors, contributionRates(b));
    }

    /** Integer percentages of PRS / CVS / DNS in their sum; all zero when the sum is zero. */
    public static ContributionRates contributionRates(ScoreBreakdown b) {
        double prs = Double.isFinite(b.prs) ? b.prs : 0.0;
        double cvs = Double.isFinite(b.cvs) ? b.cvs : 0.0;
        double dns = Double.isFinite(b.dns) ? b.dns : 0.0;

        double total = prs + cvs + dns;
        if (total == 0.0) return new ContributionRates(0, 0, 0);

        return new ContributionRates(
                (int) Math.round(prs / total * 100.0),
                (int) Math.round(cvs / total * 100.0),
                (int) Math.round(dns / total * 100.0)
        );
    }

    public record Factor(String name, double value, String description) {}

    public record ContributionRates(int prs, int cvs, int dns) {}
}
