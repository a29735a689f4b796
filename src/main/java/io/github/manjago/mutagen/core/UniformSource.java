package io.github.manjago.mutagen.core;

import java.util.List;

/**
 * Source of uniform randomness consumed by every variation operator.
 * 
 * Implementations need not be thread-safe: give each worker its own source.
 */
public interface UniformSource {
    
    /**
     * Uniformly distributed double in [0, 1).
     */
    double nextDouble();
    
    /**
     * Uniformly distributed int in [0, bound).
     */
    int nextInt(int bound);
    
    /**
     * True with probability {@code probability}.
     */
    default boolean nextBoolean(double probability) {
        return nextDouble() < probability;
    }
    
    /**
     * Fair coin.
     */
    default boolean nextBoolean() {
        return nextInt(2) == 0;
    }
    
    /**
     * Standard normal sample by the Box-Muller transform:
     * {@code sqrt(-2 ln u1) * cos(2 pi u2)} with u1, u2 uniform in (0, 1).
     */
    default double nextGaussian() {
        double u1;
        do {
            u1 = nextDouble();
        } while (u1 == 0.0);
        double u2 = nextDouble();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }
    
    /**
     * Uniformly chosen element of a non-empty list.
     */
    default <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }
}
