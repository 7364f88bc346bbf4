package org.calista.culturerank.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public final class RankResponse {
    public final String requestId;
    public final String algorithmId;
    public final String algorithmVersion;
    public final String contractVersion;

    /** Fingerprint of the effective parameters. */
    public final String paramSetId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String variantId;

    public final List<RankedItem> ranked;
    public final ConstraintsReport constraintsReport;

    public RankResponse(String requestId,
                        String algorithmId,
                        String algorithmVersion,
                        String contractVersion,
                        String paramSetId,
                        String variantId,
                        List<RankedItem> ranked,
                        ConstraintsReport constraintsReport) {
        this.requestId = requestId;
        this.algorithmId = algorithmId;
        this.algorithmVersion = algorithmVersion;
        this.contractVersion = contractVersion;
        this.paramSetId = paramSetId;
        this.variantId = variantId;
        this.ranked = ranked == null ? List.of() : List.copyOf(ranked);
        this.constraintsReport = constraintsReport;
    }
}
