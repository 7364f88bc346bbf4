package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class RankRequest {
    public String contractVersion;
    public String requestId;

    /** Seed for exploration slots. Falls back to requestId. */
    public String requestSeed;

    public String clusterVersion;
    public UserState userState;
    public List<Candidate> candidates = new ArrayList<>();
    public RankContext context;
    public ParamOverrides params;

    /**
     * Throws {@link IllegalArgumentException} on missing structure. Duplicate itemKeys are
     * rejected as well: uniqueness is part of the candidate contract.
     */
    public void validate() {
        if (requestId == null || requestId.isBlank()) throw new IllegalArgumentException("RankRequest.requestId is required");
        if (userState == null) throw new IllegalArgumentException("RankRequest.userState is required");
        if (context == null) throw new IllegalArgumentException("RankRequest.context is required");
        if (candidates == null) throw new IllegalArgumentException("RankRequest.candidates is required");

        Set<String> keys = new HashSet<>(Math.max(16, candidates.size() * 2));
        for (Candidate c : candidates) {
            if (c == null) throw new IllegalArgumentException("RankRequest.candidates contains null");
            c.validate();
            if (!keys.add(c.itemKey)) throw new IllegalArgumentException("Duplicate itemKey: " + c.itemKey);
        }
    }

    /** Seed string for the exploration generator. */
    public String seedString() {
        if (requestSeed != null && !requestSeed.isEmpty()) return requestSeed;
        return requestId == null ? "" : requestId;
    }
}
