package io.github.manjago.mutagen.track;

import io.github.manjago.mutagen.operators.GeneticOperator;

/**
 * Snapshot of one operator's outcomes.
 */
public record OperatorStats(
    GeneticOperator operator,
    long committed,         // Children that passed the size cap
    long rejected,          // Candidates discarded for exceeding it
    long pointsCommitted    // Sum of committed child sizes
) {
    
    public long attempts() {
        return committed + rejected;
    }
    
    /**
     * Fraction of attempts that produced a child.
     */
    public double acceptanceRate() {
        return attempts() > 0 ? (double) committed / attempts() : 0;
    }
    
    /**
     * Mean size of committed children.
     */
    public double meanChildPoints() {
        return committed > 0 ? (double) pointsCommitted / committed : 0;
    }
    
    @Override
    public String toString() {
        return String.format("%-22s committed=%,d rejected=%,d (%.1f%% accepted, mean size %.1f)",
                operator.getLabel(), committed, rejected, acceptanceRate() * 100, meanChildPoints());
    }
}
