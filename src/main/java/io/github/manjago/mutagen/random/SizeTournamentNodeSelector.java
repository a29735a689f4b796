package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.UniformSource;

/**
 * Draws {@code tournamentSize} nodes uniformly and keeps the one heading the largest subtree.
 * Ties go to the earliest draw.
 */
public class SizeTournamentNodeSelector implements NodeSelector {
    
    private final UniformSource rng;
    private final int tournamentSize;
    
    public SizeTournamentNodeSelector(UniformSource rng, int tournamentSize) {
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("tournamentSize must be positive: " + tournamentSize);
        }
        this.rng = rng;
        this.tournamentSize = tournamentSize;
    }
    
    @Override
    public int select(Program program) {
        int best = rng.nextInt(program.points());
        int bestSize = Points.nodeAt(program, best).points();
        for (int round = 1; round < tournamentSize; round++) {
            int candidate = rng.nextInt(program.points());
            int size = Points.nodeAt(program, candidate).points();
            if (size > bestSize) {
                best = candidate;
                bestSize = size;
            }
        }
        return best;
    }
}
