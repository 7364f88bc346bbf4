package org.calista.culturerank.model;

import java.util.List;

public final class RankedItem {
    public final String itemKey;
    public final ContentType type;
    public final String clusterId;
    public final double finalScore;
    public final List<ReasonCode> reasonCodes;
    public final ScoreBreakdown scoreBreakdown;

    public RankedItem(String itemKey,
                      ContentType type,
                      String clusterId,
                      double finalScore,
                      List<ReasonCode> reasonCodes,
                      ScoreBreakdown scoreBreakdown) {
        this.itemKey = itemKey;
        this.type = type;
        this.clusterId = clusterId;
        this.finalScore = finalScore;
        this.reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        this.scoreBreakdown = scoreBreakdown;
    }

    @Override
    public String toString() {
        return "RankedItem{" + itemKey + ", score=" + finalScore + ", reasons=" + reasonCodes + '}';
    }
}
