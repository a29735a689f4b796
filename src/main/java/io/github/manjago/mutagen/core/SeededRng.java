package io.github.manjago.mutagen.core;

import org.apache.commons.rng.JumpableUniformRandomProvider;
import org.apache.commons.rng.RandomProviderState;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.core.RandomProviderDefaultState;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Deterministic random number generator with save/restore and split.
 * 
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP algorithm:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 * - Jumpable, so independent streams can be handed to worker threads
 * 
 * IMPORTANT: Do not change RandomSource between versions!
 * Changing algorithm would break replay of seeded runs.
 */
public final class SeededRng implements UniformSource {
    
    /**
     * Fixed algorithm - DO NOT CHANGE for backwards compatibility.
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;
    
    private final long initialSeed;
    private final RestorableUniformRandomProvider rng;
    
    /**
     * Create new RNG with given seed.
     */
    public SeededRng(long seed) {
        this(seed, ALGORITHM.create(seed));
    }
    
    private SeededRng(long initialSeed, RestorableUniformRandomProvider rng) {
        this.initialSeed = initialSeed;
        this.rng = rng;
    }
    
    // ========== Random Methods ==========
    
    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }
    
    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }
    
    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng.nextLong();
    }
    
    // ========== Streams ==========
    
    /**
     * Independent generator for another worker.
     * 
     * The returned generator continues from this one's current state, while this one
     * jumps 2^64 steps ahead, so the two sequences never overlap in practice.
     */
    public SeededRng split() {
        RestorableUniformRandomProvider copy =
                (RestorableUniformRandomProvider) ((JumpableUniformRandomProvider) rng).jump();
        return new SeededRng(initialSeed, copy);
    }
    
    // ========== State Management ==========
    
    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
    
    /**
     * Snapshot the current state, e.g. to replay a variation step.
     */
    public RngState saveState() {
        RandomProviderState state = rng.saveState();
        // Extract raw byte[] from Apache Commons RNG state
        byte[] stateBytes = ((RandomProviderDefaultState) state).getState();
        return new RngState(initialSeed, stateBytes);
    }
    
    /**
     * Restore RNG from saved state.
     */
    public static SeededRng restore(RngState state) {
        RestorableUniformRandomProvider provider = ALGORITHM.create(state.initialSeed());
        provider.restoreState(new RandomProviderDefaultState(state.stateBytes()));
        return new SeededRng(state.initialSeed(), provider);
    }
    
    /**
     * Immutable snapshot of RNG state.
     */
    public record RngState(long initialSeed, byte[] stateBytes) {
        
        public RngState {
            stateBytes = stateBytes.clone();
        }
        
        @Override
        public byte[] stateBytes() {
            return stateBytes.clone();
        }
    }
}
