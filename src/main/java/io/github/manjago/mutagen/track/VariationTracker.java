package io.github.manjago.mutagen.track;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.operators.GeneticOperator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts commits and rejections per operator.
 * 
 * Counters are lock-free, so one tracker can be shared by every worker's engine.
 */
public class VariationTracker implements VariationListener {
    
    private final Map<GeneticOperator, Counters> counters = new EnumMap<>(GeneticOperator.class);
    
    public VariationTracker() {
        // All keys present up front: the map itself is never modified afterwards
        for (GeneticOperator op : GeneticOperator.values()) {
            counters.put(op, new Counters());
        }
    }
    
    @Override
    public void onCommit(GeneticOperator operator, Individual parent, Individual child) {
        Counters c = counters.get(operator);
        c.committed.increment();
        c.points.add(child.points());
    }
    
    @Override
    public void onReject(GeneticOperator operator, Individual parent, int candidatePoints, int maxPoints) {
        counters.get(operator).rejected.increment();
    }
    
    /**
     * Get statistics for one operator.
     */
    public OperatorStats getStats(GeneticOperator operator) {
        Counters c = counters.get(operator);
        return new OperatorStats(operator, c.committed.sum(), c.rejected.sum(), c.points.sum());
    }
    
    /**
     * Get statistics for every operator that was used at least once.
     */
    public List<OperatorStats> getUsedStats() {
        List<OperatorStats> used = new ArrayList<>();
        for (GeneticOperator op : GeneticOperator.values()) {
            OperatorStats stats = getStats(op);
            if (stats.attempts() > 0) {
                used.add(stats);
            }
        }
        return used;
    }
    
    public long getTotalCommitted() {
        return counters.values().stream().mapToLong(c -> c.committed.sum()).sum();
    }
    
    public long getTotalRejected() {
        return counters.values().stream().mapToLong(c -> c.rejected.sum()).sum();
    }
    
    /**
     * Get summary line.
     */
    public String getSummary() {
        long committed = getTotalCommitted();
        long rejected = getTotalRejected();
        if (committed + rejected == 0) {
            return "No variations recorded";
        }
        return String.format("Variations: %,d committed, %,d rejected", committed, rejected);
    }
    
    /**
     * Clear all counters.
     */
    public void reset() {
        for (Counters c : counters.values()) {
            c.committed.reset();
            c.rejected.reset();
            c.points.reset();
        }
    }
    
    private static final class Counters {
        final LongAdder committed = new LongAdder();
        final LongAdder rejected = new LongAdder();
        final LongAdder points = new LongAdder();
    }
}
