package org.calista.culturerank.model;

public enum ReasonCode {
    SIMILAR_TO_SAVED,
    SIMILAR_TO_LIKED,
    FOLLOWING,
    GROWING_CONTEXT,
    BRIDGE_SUCCESS,
    DIVERSITY_SLOT,
    EXPLORATION,
    HIGH_SUPPORT_DENSITY,
    TRENDING_IN_CLUSTER,
    NEW_IN_CLUSTER,
    /** Reserved for editorially pinned items; the ranking core never emits it. */
    EDITORIAL
}
