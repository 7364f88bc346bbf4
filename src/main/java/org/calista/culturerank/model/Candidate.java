package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A content item offered to the ranker. Treated as read-only for the whole call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Candidate {

    public String itemKey;
    public ContentType type = ContentType.POST;
    public String clusterId;

    /** Creation time, epoch millis. */
    public long createdAt;

    public QualityFlags qualityFlags;
    public CandidateFeatures features;

    /**
     * Structural check only; never normalizes. A broken candidate is an upstream contract
     * violation and is reported as such.
     */
    public void validate() {
        if (itemKey == null || itemKey.isBlank()) throw new IllegalArgumentException("Candidate.itemKey is required");
        if (clusterId == null) throw new IllegalArgumentException("Candidate.clusterId is required: " + itemKey);
        if (qualityFlags == null) throw new IllegalArgumentException("Candidate.qualityFlags is required: " + itemKey);
        if (features == null) throw new IllegalArgumentException("Candidate.features is required: " + itemKey);
        if (features.cvsComponents == null) {
            throw new IllegalArgumentException("Candidate.features.cvsComponents is required: " + itemKey);
        }
    }

    public boolean hardBlocked() {
        return qualityFlags != null && qualityFlags.hardBlock;
    }

    @Override
    public String toString() {
        return "Candidate{" + itemKey + ", cluster=" + clusterId + '}';
    }
}
