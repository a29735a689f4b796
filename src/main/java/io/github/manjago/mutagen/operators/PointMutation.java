package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.random.CodeGenerator;
import io.github.manjago.mutagen.random.NodeSelector;
import io.github.manjago.mutagen.random.Vocabulary;

/**
 * Replaces a selected subtree with freshly generated random code.
 */
public class PointMutation implements Mutation {
    
    private final NodeSelector selector;
    private final CodeGenerator generator;
    private final Vocabulary vocabulary;
    private final int mutationMaxPoints;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    /**
     * @param mutationMaxPoints size bound for the inserted code
     * @param maxPoints size cap for the child
     */
    public PointMutation(NodeSelector selector, CodeGenerator generator, Vocabulary vocabulary,
                         int mutationMaxPoints, int maxPoints, CommitPolicy policy) {
        if (mutationMaxPoints < 1) {
            throw new IllegalArgumentException("mutationMaxPoints must be positive: " + mutationMaxPoints);
        }
        this.selector = selector;
        this.generator = generator;
        this.vocabulary = vocabulary;
        this.mutationMaxPoints = mutationMaxPoints;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program program = parent.program();
        int index = selector.select(program);
        Program replacement = generator.generate(mutationMaxPoints, vocabulary);
        Program candidate = Points.replaceNodeAt(program, index, replacement);
        return policy.commit(GeneticOperator.MUTATION, parent, candidate, maxPoints);
    }
}
