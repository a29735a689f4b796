package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.random.NodeSelector;

/**
 * Subtree crossover: a selected subtree of the first parent is replaced by a
 * selected subtree of the second.
 */
public class Crossover implements Recombination {
    
    private final NodeSelector selector;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    public Crossover(NodeSelector selector, int maxPoints, CommitPolicy policy) {
        this.selector = selector;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual recombine(Individual first, Individual second) {
        Program receiver = first.program();
        Program donor = second.program();
        int at = selector.select(receiver);
        Program graft = Points.nodeAt(donor, selector.select(donor));
        Program candidate = Points.replaceNodeAt(receiver, at, graft);
        return policy.commit(GeneticOperator.CROSSOVER, first, candidate, maxPoints);
    }
}
