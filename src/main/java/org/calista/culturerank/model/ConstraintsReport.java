package org.calista.culturerank.model;

/**
 * What the diversity pass did, produced once per ranking call.
 */
public final class ConstraintsReport {

    public final DiversityStrategy usedStrategy;

    /** Number of times a candidate was passed over (MMR) or admitted over (DPP) because of the cluster cap. */
    public final int capAppliedCount;

    public final int explorationSlotsRequested;
    public final int explorationSlotsFilled;

    public final int effectiveDiversityCapK;
    public final double effectiveExplorationBudget;
    public final ScoreWeights effectiveWeights;

    public ConstraintsReport(DiversityStrategy usedStrategy,
                             int capAppliedCount,
                             int explorationSlotsRequested,
                             int explorationSlotsFilled,
                             int effectiveDiversityCapK,
                             double effectiveExplorationBudget,
                             ScoreWeights effectiveWeights) {
        this.usedStrategy = usedStrategy;
        this.capAppliedCount = capAppliedCount;
        this.explorationSlotsRequested = explorationSlotsRequested;
        this.explorationSlotsFilled = explorationSlotsFilled;
        this.effectiveDiversityCapK = effectiveDiversityCapK;
        this.effectiveExplorationBudget = effectiveExplorationBudget;
        this.effectiveWeights = effectiveWeights;
    }

    public static ConstraintsReport none(int effectiveK, double effectiveBudget, ScoreWeights weights) {
        return new ConstraintsReport(DiversityStrategy.NONE, 0, 0, 0, effectiveK, effectiveBudget, weights);
    }

    @Override
    public String toString() {
        return "ConstraintsReport{strategy=" + usedStrategy
                + ", capApplied=" + capAppliedCount
                + ", exploration=" + explorationSlotsFilled + "/" + explorationSlotsRequested
                + ", K=" + effectiveDiversityCapK
                + ", budget=" + effectiveExplorationBudget
                + ", weights=" + effectiveWeights + '}';
    }
}
