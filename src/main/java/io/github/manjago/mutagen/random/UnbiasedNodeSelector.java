package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.UniformSource;

/**
 * Every node equally likely.
 */
public class UnbiasedNodeSelector implements NodeSelector {
    
    private final UniformSource rng;
    
    public UnbiasedNodeSelector(UniformSource rng) {
        this.rng = rng;
    }
    
    @Override
    public int select(Program program) {
        return rng.nextInt(program.points());
    }
}
