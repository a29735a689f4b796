package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.UniformSource;

import java.util.List;

/**
 * Chooses a leaf with probability {@code leafProbability}, otherwise an internal node.
 * 
 * Uniform selection over a typical program lands on leaves most of the time; this
 * selector lets larger subtrees be picked more often.
 */
public class LeafProbabilityNodeSelector implements NodeSelector {
    
    private final UniformSource rng;
    private final double leafProbability;
    
    public LeafProbabilityNodeSelector(UniformSource rng, double leafProbability) {
        if (leafProbability < 0.0 || leafProbability > 1.0) {
            throw new IllegalArgumentException("leafProbability must be in [0, 1]: " + leafProbability);
        }
        this.rng = rng;
        this.leafProbability = leafProbability;
    }
    
    @Override
    public int select(Program program) {
        List<Integer> internal = Points.indicesOf(program, false);
        if (internal.isEmpty() || rng.nextBoolean(leafProbability)) {
            return rng.pick(Points.indicesOf(program, true));
        }
        return rng.pick(internal);
    }
}
