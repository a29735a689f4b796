package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.ProgramList;
import io.github.manjago.mutagen.core.UniformSource;
import io.github.manjago.mutagen.random.NodeSelector;
import io.github.manjago.mutagen.tag.Tags;

/**
 * Replaces a subtree by a tag reference and stores the subtree under that tag up front.
 * <pre>
 *   program (a (b c) d), node (b c), tag 7
 *   -&gt; ((tag_exec_7 (b c)) (a tagged_7 d))
 * </pre>
 */
public class TaggingMutation implements Mutation {
    
    private final NodeSelector selector;
    private final UniformSource rng;
    private final int tagLimit;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    /**
     * @param tagLimit tags are drawn uniformly from [0, tagLimit)
     */
    public TaggingMutation(NodeSelector selector, UniformSource rng, int tagLimit,
                           int maxPoints, CommitPolicy policy) {
        if (tagLimit < 1) {
            throw new IllegalArgumentException("tagLimit must be positive: " + tagLimit);
        }
        this.selector = selector;
        this.rng = rng;
        this.tagLimit = tagLimit;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program program = parent.program();
        int index = selector.select(program);
        int tag = rng.nextInt(tagLimit);
        
        ProgramList tagging = ProgramList.of(Tags.write(tag), Points.nodeAt(program, index));
        Program referencing = Points.replaceNodeAt(program, index, Tags.reference(tag));
        Program candidate = ProgramList.of(tagging, referencing);
        
        return policy.commit(GeneticOperator.TAGGING, parent, candidate, maxPoints);
    }
}
