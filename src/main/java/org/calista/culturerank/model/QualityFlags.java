package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class QualityFlags {
    public boolean moderated;
    public boolean nsfw;
    public boolean spamSuspect;

    /** Hard-blocked items are removed before scoring, never penalized. */
    public boolean hardBlock;

    public static QualityFlags moderatedOnly() {
        QualityFlags f = new QualityFlags();
        f.moderated = true;
        return f;
    }
}
