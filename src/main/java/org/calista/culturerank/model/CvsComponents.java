package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Cultural-value sub-signals, each precomputed upstream and expected in [0..1].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CvsComponents {
    public double like;
    public double context;
    public double collection;
    public double bridge;
    public double sustain;

    public static CvsComponents of(double like, double context, double collection, double bridge, double sustain) {
        CvsComponents c = new CvsComponents();
        c.like = like;
        c.context = context;
        c.collection = collection;
        c.bridge = bridge;
        c.sustain = sustain;
        return c;
    }
}
