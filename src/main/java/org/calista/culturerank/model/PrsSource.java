package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Why the upstream relevance model considers an item personally relevant. */
public enum PrsSource {
    @JsonProperty("saved") SAVED,
    @JsonProperty("liked") LIKED,
    @JsonProperty("following") FOLLOWING
}
