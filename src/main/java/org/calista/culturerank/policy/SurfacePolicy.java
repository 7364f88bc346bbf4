package org.calista.culturerank.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.culturerank.model.Candidate;

/**
 * Boolean filter a surface applies to candidates before scoring.
 */
public final class SurfacePolicy {

    public static final SurfacePolicy MODERATED_ONLY = new SurfacePolicy(true, false);
    public static final SurfacePolicy MODERATED_SAFE = new SurfacePolicy(true, true);
    public static final SurfacePolicy OPEN = new SurfacePolicy(false, false);

    public final boolean requireModerated;
    public final boolean excludeNsfw;

    @JsonCreator
    public SurfacePolicy(@JsonProperty("requireModerated") boolean requireModerated,
                         @JsonProperty("excludeNsfw") boolean excludeNsfw) {
        this.requireModerated = requireModerated;
        this.excludeNsfw = excludeNsfw;
    }

    public boolean allows(Candidate c) {
        if (c.qualityFlags == null) return !requireModerated;
        if (requireModerated && !c.qualityFlags.moderated) return false;
        return !(excludeNsfw && c.qualityFlags.nsfw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurfacePolicy p)) return false;
        return requireModerated == p.requireModerated && excludeNsfw == p.excludeNsfw;
    }

    @Override
    public int hashCode() {
        return (requireModerated ? 2 : 0) | (excludeNsfw ? 1 : 0);
    }

    @Override
    public String toString() {
        return "SurfacePolicy{moderated=" + requireModerated + ", noNsfw=" + excludeNsfw + '}';
    }
}
