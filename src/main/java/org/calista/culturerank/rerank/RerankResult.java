package org.calista.culturerank.rerank;

import org.calista.culturerank.model.ConstraintsReport;
import org.calista.culturerank.model.ReasonCode;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered picks of a rerank call plus its constraints report.
 */
public final class RerankResult {

    public final List<Pick> picks;
    public final ConstraintsReport report;

    public RerankResult(List<Pick> picks, ConstraintsReport report) {
        this.picks = picks == null ? List.of() : List.copyOf(picks);
        this.report = Objects.requireNonNull(report, "report");
    }

    public static RerankResult empty(ConstraintsReport report) {
        return new RerankResult(List.of(), report);
    }

    public List<ScoredCandidate> candidates() {
        ArrayList<ScoredCandidate> out = new ArrayList<>(picks.size());
        for (Pick p : picks) out.add(p.scored());
        return out;
    }

    public List<String> itemKeys() {
        ArrayList<String> out = new ArrayList<>(picks.size());
        for (Pick p : picks) out.add(p.scored().itemKey());
        return out;
    }

    public record Pick(ScoredCandidate scored, List<ReasonCode> reasonCodes) {
        public Pick {
            Objects.requireNonNull(scored, "scored");
            reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        }
    }
}
