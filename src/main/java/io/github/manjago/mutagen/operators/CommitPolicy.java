package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.track.VariationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Size-gated commit shared by every operator.
 * 
 * A candidate larger than the cap is discarded and the parent is returned as is.
 * Otherwise the candidate becomes a new individual inheriting the parent's history,
 * with the parent's program prepended to the lineage when ancestry is maintained.
 */
public final class CommitPolicy {
    
    private static final Logger log = LoggerFactory.getLogger(CommitPolicy.class);
    
    private final boolean maintainAncestors;
    private final VariationListener listener;
    
    public CommitPolicy(boolean maintainAncestors, VariationListener listener) {
        this.maintainAncestors = maintainAncestors;
        this.listener = listener != null ? listener : VariationListener.NOOP;
    }
    
    public CommitPolicy(boolean maintainAncestors) {
        this(maintainAncestors, VariationListener.NOOP);
    }
    
    /**
     * Accept or reject a candidate program.
     * 
     * @param operator operator that built the candidate
     * @param parent first (or only) parent
     * @param candidate the candidate program
     * @param maxPoints size cap
     * @return the new child, or {@code parent} when the candidate exceeds the cap
     */
    public Individual commit(GeneticOperator operator, Individual parent, Program candidate, int maxPoints) {
        Objects.requireNonNull(candidate, "candidate");
        int points = candidate.points();
        if (points > maxPoints) {
            log.debug("{} rejected: {} points > max {}", operator, points, maxPoints);
            listener.onReject(operator, parent, points, maxPoints);
            return parent;
        }
        Individual child = parent.child(candidate, maintainAncestors);
        listener.onCommit(operator, parent, child);
        return child;
    }
    
    public boolean isMaintainAncestors() {
        return maintainAncestors;
    }
    
    public VariationListener getListener() {
        return listener;
    }
}
