package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.random.CodeGenerator;
import io.github.manjago.mutagen.random.Vocabulary;

/**
 * Boolean geometric semantic crossover.
 * 
 * The child is {@code (new-random-code exec_if parent1-code parent2-code)}: random code
 * pushes a boolean, and the conditional runs one of the two whole parent programs.
 */
public class BooleanGsxover implements Recombination {
    
    private final CodeGenerator generator;
    private final Vocabulary vocabulary;
    private final int newCodeMaxPoints;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    /**
     * @param vocabulary atoms for the random condition, normally boolean-producing ones
     * @param newCodeMaxPoints size bound for the random condition
     */
    public BooleanGsxover(CodeGenerator generator, Vocabulary vocabulary, int newCodeMaxPoints,
                          int maxPoints, CommitPolicy policy) {
        if (newCodeMaxPoints < 1) {
            throw new IllegalArgumentException("newCodeMaxPoints must be positive: " + newCodeMaxPoints);
        }
        this.generator = generator;
        this.vocabulary = vocabulary;
        this.newCodeMaxPoints = newCodeMaxPoints;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual recombine(Individual first, Individual second) {
        Program condition = generator.generate(newCodeMaxPoints, vocabulary);
        Program candidate = ProgramList.of(
                condition,
                TagBranchInsertion.CONDITIONAL,
                first.program(),
                second.program());
        return policy.commit(GeneticOperator.BOOLEAN_GSXOVER, first, candidate, maxPoints);
    }
}
