package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.UniformSource;
import io.github.manjago.mutagen.tag.Tags;

import java.util.List;

/**
 * Inserts a tag branch at a random position of the top-level list.
 * 
 * A tag branch compares copies (not popped) of the top two items of a randomly chosen
 * type and branches to one of two tags on the result:
 * <pre>
 *   (1 integer_yankdup 1 integer_yankdup integer_eq exec_if tagged_3 tagged_12)
 * </pre>
 * A bare atom program is treated as a one-element list.
 */
public class TagBranchInsertion implements Mutation {
    
    static final Atom CONDITIONAL = Atom.instruction("exec_if");
    private static final Atom DEPTH_ONE = Atom.integer(1);
    
    private final UniformSource rng;
    private final List<TypeComparison> comparisons;
    private final int tagLimit;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    public TagBranchInsertion(UniformSource rng, List<TypeComparison> comparisons, int tagLimit,
                              int maxPoints, CommitPolicy policy) {
        if (comparisons.isEmpty()) {
            throw new IllegalArgumentException("At least one type comparison is required");
        }
        if (tagLimit < 1) {
            throw new IllegalArgumentException("tagLimit must be positive: " + tagLimit);
        }
        this.rng = rng;
        this.comparisons = List.copyOf(comparisons);
        this.tagLimit = tagLimit;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program program = parent.program();
        ProgramList top = program instanceof ProgramList list ? list : ProgramList.of(program);
        
        ProgramList branch = buildBranch();
        int position = rng.nextInt(top.size() + 1);
        Program candidate = top.inserting(position, branch);
        
        return policy.commit(GeneticOperator.TAG_BRANCH_INSERTION, parent, candidate, maxPoints);
    }
    
    ProgramList buildBranch() {
        int firstTag = rng.nextInt(tagLimit);
        int secondTag = rng.nextInt(tagLimit);
        TypeComparison comparison = rng.pick(comparisons);
        Atom yankdup = Atom.instruction(comparison.yankdupInstruction());
        return ProgramList.of(
                DEPTH_ONE, yankdup,
                DEPTH_ONE, yankdup,
                Atom.instruction(comparison.equalityInstruction()),
                CONDITIONAL,
                Tags.reference(firstTag),
                Tags.reference(secondTag));
    }
}
