package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Blend weights for PRS / CVS / DNS. Effective (slider-adjusted) weights always sum to 1.
 */
public final class ScoreWeights {

    public final double prs;
    public final double cvs;
    public final double dns;

    @JsonCreator
    public ScoreWeights(@JsonProperty("prs") double prs,
                        @JsonProperty("cvs") double cvs,
                        @JsonProperty("dns") double dns) {
        this.prs = prs;
        this.cvs = cvs;
        this.dns = dns;
    }

    public static ScoreWeights of(double prs, double cvs, double dns) {
        return new ScoreWeights(prs, cvs, dns);
    }

    public double sum() {
        return prs + cvs + dns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreWeights w)) return false;
        return Double.compare(prs, w.prs) == 0 && Double.compare(cvs, w.cvs) == 0 && Double.compare(dns, w.dns) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prs, cvs, dns);
    }

    @Override
    public String toString() {
        return "ScoreWeights{prs=" + prs + ", cvs=" + cvs + ", dns=" + dns + '}';
    }
}
