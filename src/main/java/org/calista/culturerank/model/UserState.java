package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * User snapshot. Only the slider and the cluster exposures are read by the core;
 * the remaining fields belong to external collaborators and are carried through.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserState {
    public String userKey;

    /** 0 = most familiar feed, 1 = most diverse feed. */
    public double diversitySlider = 0.5;

    /** Recent exposure count per clusterId. */
    public Map<String, Integer> recentClusterExposures = new HashMap<>();

    public int likeWindowCount;
    public double curatorReputation = 1.0;
    public double cpEarned90d;

    /** Exposure lookup; missing, null and negative counts read as 0. */
    public int exposureOf(String clusterId) {
        return exposureOf(recentClusterExposures, clusterId);
    }

    public static int exposureOf(Map<String, Integer> exposures, String clusterId) {
        if (exposures == null || clusterId == null) return 0;
        Integer v = exposures.get(clusterId);
        return v == null ? 0 : Math.max(0, v);
    }
}
