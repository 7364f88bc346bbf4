package org.calista.culturerank.policy;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Surface name to {@link SurfacePolicy}. Unknown surfaces get the fallback policy.
 */
public final class SurfacePolicyTable {

    public static final String HOME_MIX = "home_mix";
    public static final String HOME_DIVERSE = "home_diverse";

    private final Map<String, SurfacePolicy> policies;
    private final SurfacePolicy fallback;

    public SurfacePolicyTable(Map<String, SurfacePolicy> policies, SurfacePolicy fallback) {
        this.policies = new TreeMap<>(Objects.requireNonNull(policies, "policies"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /**
     * Moderated content everywhere, and no nsfw on the home feeds.
     */
    public static SurfacePolicyTable defaults() {
        TreeMap<String, SurfacePolicy> m = new TreeMap<>();
        m.put(HOME_MIX, SurfacePolicy.MODERATED_SAFE);
        m.put(HOME_DIVERSE, SurfacePolicy.MODERATED_SAFE);
        m.put("following", SurfacePolicy.MODERATED_ONLY);
        m.put("scenes", SurfacePolicy.MODERATED_ONLY);
        m.put("search", SurfacePolicy.MODERATED_ONLY);
        m.put("work_page", SurfacePolicy.MODERATED_ONLY);
        return new SurfacePolicyTable(m, SurfacePolicy.MODERATED_ONLY);
    }

    /** Defaults with the given entries layered on top. */
    public static SurfacePolicyTable defaultsWith(Map<String, SurfacePolicy> overrides) {
        SurfacePolicyTable base = defaults();
        if (overrides == null || overrides.isEmpty()) return base;
        TreeMap<String, SurfacePolicy> m = new TreeMap<>(base.policies);
        overrides.forEach((k, v) -> {
            if (k != null && v != null) m.put(k, v);
        });
        return new SurfacePolicyTable(m, base.fallback);
    }

    public SurfacePolicy forSurface(String surface) {
        if (surface == null) return fallback;
        return policies.getOrDefault(surface, fallback);
    }

    public Map<String, SurfacePolicy> asMap() {
        return Map.copyOf(policies);
    }
}
