package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class RankContext {
    /** Surface name, e.g. home_mix, home_diverse, following, scenes, search, work_page. */
    public String surface = "home_mix";

    /** Request time, epoch millis. */
    public long nowTs;
}
