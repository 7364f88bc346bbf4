package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ContentType {
    @JsonProperty("post") POST,
    @JsonProperty("work") WORK,
    @JsonProperty("collection") COLLECTION,
    @JsonProperty("note") NOTE,
    @JsonProperty("bridge") BRIDGE
}
