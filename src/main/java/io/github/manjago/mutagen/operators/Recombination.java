package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;

/**
 * Two-parent variation operator.
 */
@FunctionalInterface
public interface Recombination {
    
    /**
     * @param first parent whose history and lineage the child inherits
     * @param second donor parent
     * @return a new child, or {@code first} itself if the child was rejected
     */
    Individual recombine(Individual first, Individual second);
}
