package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Program;

/**
 * Chooses the node of a program that a variation operator will act on.
 */
@FunctionalInterface
public interface NodeSelector {
    
    /**
     * Select a node.
     * 
     * @param program program to select from
     * @return traversal index in [0, program.points())
     */
    int select(Program program);
}
