package io.github.manjago.mutagen.operators;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.Individual;
import io.github.manjago.mutagen.core.Points;
import io.github.manjago.mutagen.core.Program;
import io.github.manjago.mutagen.core.UniformSource;

/**
 * Perturbs float literals with Gaussian noise.
 * 
 * Each float is replaced, with probability {@code perturbProbability}, by
 * {@code value + sd * N(0, 1)}. Other atoms and the tree shape are left untouched.
 */
public class GaussianMutation implements Mutation {
    
    private final UniformSource rng;
    private final double perturbProbability;
    private final double standardDeviation;
    private final int maxPoints;
    private final CommitPolicy policy;
    
    public GaussianMutation(UniformSource rng, double perturbProbability, double standardDeviation,
                            int maxPoints, CommitPolicy policy) {
        this.rng = rng;
        this.perturbProbability = perturbProbability;
        this.standardDeviation = standardDeviation;
        this.maxPoints = maxPoints;
        this.policy = policy;
    }
    
    @Override
    public Individual mutate(Individual parent) {
        Program candidate = Points.mapAtoms(parent.program(), this::perturb);
        // Shape is unchanged, so only a parent already over the cap is rejected
        return policy.commit(GeneticOperator.GAUSSIAN, parent, candidate, maxPoints);
    }
    
    private Atom perturb(Atom atom) {
        if (atom.isFloat() && rng.nextBoolean(perturbProbability)) {
            double value = atom.doubleValue() + standardDeviation * rng.nextGaussian();
            // Overflow keeps the old value
            return Double.isFinite(value) ? Atom.floating(value) : atom;
        }
        return atom;
    }
}
