package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.UniformSource;

/**
 * Deletes between 1 and 4 points.
 * 
 * The number of deletions roughly follows a binomial law with n=4 and p=0.25, moved up
 * by one so that 0 is never chosen:
 * <pre>
 *   p(1) = 0.32   p(2) = 0.42   p(3) = 0.21   p(4) = 0.05
 * </pre>
 * Each deletion picks a uniform node of the current program. A list is un-nested
 * (its brackets removed) with probability 0.2, otherwise the node is removed whole.
 */
public class DeletionMutation implements Mutation {
    
    /** Cumulative cut points of the deletion-count table. DO NOT re-derive. */
    private static final double[] CUMULATIVE = {0.32, 0.74, 0.95};
    
    static final double COLLAPSE_PROBABILITY = 0.2;
    
    private final UniformSource rng;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    public DeletionMutation(UniformSource rng, int maxPoints, CommitPolicy policy) {
        this.rng = rng;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program program = parent.program();
        int deletions = deletionCount(rng.nextDouble());
        for (int i = 0; i < deletions; i++) {
            program = deleteOnce(program);
        }
        return policy.commit(GeneticOperator.DELETION, parent, program, maxPoints);
    }
    
    private Program deleteOnce(Program program) {
        int index = rng.nextInt(program.points());
        Program node = Points.nodeAt(program, index);
        if (node.isList() && rng.nextBoolean(COLLAPSE_PROBABILITY)) {
            return Points.collapseBracketsAt(program, index);
        }
        return Points.removeNodeAt(program, index);
    }
    
    /**
     * Map a uniform draw in [0, 1) to a deletion count in 1..4.
     */
    static int deletionCount(double draw) {
        for (int i = 0; i < CUMULATIVE.length; i++) {
            if (draw < CUMULATIVE[i]) {
                return i + 1;
            }
        }
        return CUMULATIVE.length + 1;
    }
}
