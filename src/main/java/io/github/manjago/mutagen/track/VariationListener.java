package io.github.manjago.mutagen.track;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.operators.GeneticOperator;

/**
 * Listener for variation events.
 * 
 * Implement this interface to react to commits and rejections, for example to
 * collect statistics or to log lineage. Implementations may be called from several
 * worker threads at once.
 */
public interface VariationListener {
    
    /**
     * Called when an operator's child passed the size check.
     * 
     * @param operator the operator that produced the child
     * @param parent the first (or only) parent
     * @param child the new individual
     */
    default void onCommit(GeneticOperator operator, Individual parent, Individual child) {}
    
    /**
     * Called when an operator's candidate was too large and the parent was returned.
     * 
     * @param operator the operator that produced the candidate
     * @param parent the first (or only) parent, returned unchanged
     * @param candidatePoints size of the rejected candidate
     * @param maxPoints the size cap it exceeded
     */
    default void onReject(GeneticOperator operator, Individual parent, int candidatePoints, int maxPoints) {}
    
    /**
     * No-op listener that does nothing.
     */
    VariationListener NOOP = new VariationListener() {};
}
