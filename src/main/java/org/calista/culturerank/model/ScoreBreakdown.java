package org.calista.culturerank.model;

/**
 * Per-candidate score components for one call. Never persisted.
 */
public final class ScoreBreakdown {
    public final double prs;
    public final double cvs;
    public final double dns;
    public final double penalty;
    public final double finalScore;

    public ScoreBreakdown(double prs, double cvs, double dns, double penalty, double finalScore) {
        this.prs = prs;
        this.cvs = cvs;
        this.dns = dns;
        this.penalty = penalty;
        this.finalScore = finalScore;
    }

    @Override
    public String toString() {
        return "ScoreBreakdown{prs=" + prs + ", cvs=" + cvs + ", dns=" + dns
                + ", penalty=" + penalty + ", final=" + finalScore + '}';
    }
}
