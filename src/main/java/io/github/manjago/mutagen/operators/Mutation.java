package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;

/**
 * Single-parent variation operator.
 */
@FunctionalInterface
public interface Mutation {
    
    /**
     * @param parent individual to vary
     * @return a new child, or {@code parent} itself if the child was rejected
     */
    Individual mutate(Individual parent);
}
