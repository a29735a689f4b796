package io.github.manjago.mutagen.random;

import io.github.manjago.mutagen.core.Atom;
import io.github.manjago.mutagen.core.UniformSource;

/**
 * Produces one atom per call: a fixed instruction or an ephemeral random constant.
 */
@FunctionalInterface
public interface AtomGenerator {
    
    Atom generate(UniformSource rng);
    
    /**
     * Generator that always yields {@code atom}.
     */
    static AtomGenerator constant(Atom atom) {
        return new Constant(atom);
    }
    
    /**
     * Integer constant uniform in [min, max].
     */
    static AtomGenerator integerErc(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Empty integer range [" + min + ", " + max + "]");
        }
        long span = (long) max - min + 1;
        if (span > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Integer range [" + min + ", " + max + "] is too wide");
        }
        return rng -> Atom.integer(min + (long) rng.nextInt((int) span));
    }
    
    /**
     * Float constant uniform in [min, max).
     */
    static AtomGenerator floatErc(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max - min)) {
            throw new IllegalArgumentException("Float range [" + min + ", " + max + ") is not finite");
        }
        if (!(max > min)) {
            throw new IllegalArgumentException("Empty float range [" + min + ", " + max + ")");
        }
        return rng -> Atom.floating(min + (max - min) * rng.nextDouble());
    }
    
    /**
     * Constant generator, kept as a record so vocabularies compare and print nicely.
     */
    record Constant(Atom atom) implements AtomGenerator {
        @Override
        public Atom generate(UniformSource rng) {
            return atom;
        }
        
        @Override
        public String toString() {
            return atom.toString();
        }
    }
}
