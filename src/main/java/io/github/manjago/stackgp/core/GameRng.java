package io.github.manjago.stackgp.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Deterministic random number generator.
 * 
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP algorithm:
 * - Fast and high quality
 * - State is just 2 longs (128 bits)
 * - Cheap to create, so every offspring slot gets its own stream
 * 
 * Streams are derived from (run seed, generation, slot) so the draws for a
 * given individual never depend on the order in which other individuals
 * were processed.
 * 
 * IMPORTANT: Do not change RandomSource or the derivation between versions!
 * Changing either would break replay determinism.
 */
public final class GameRng {
    
    /**
     * Fixed algorithm - DO NOT CHANGE for backwards compatibility.
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;
    
    private final long initialSeed;
    private final UniformRandomProvider rng;
    
    /**
     * Create new RNG with given seed.
     */
    public GameRng(long seed) {
        this.initialSeed = seed;
        this.rng = ALGORITHM.create(seed);
    }
    
    /**
     * Derive an independent stream for one slot of one generation.
     * 
     * @param runSeed seed of the whole run
     * @param generation generation index
     * @param slot individual index within the generation
     */
    public static GameRng derive(long runSeed, int generation, int slot) {
        long h = mix(runSeed);
        h = mix(h ^ (0x9E3779B97F4A7C15L * (generation + 1L)));
        h = mix(h ^ (0xC2B2AE3D27D4EB4FL * (slot + 1L)));
        return new GameRng(h);
    }
    
    /**
     * SplitMix64 finalizer.
     */
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
    
    // ========== Random Methods (compatible with java.util.Random API) ==========
    
    /**
     * Returns uniformly distributed int.
     */
    public int nextInt() {
        return rng.nextInt();
    }
    
    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }
    
    /**
     * Returns uniformly distributed int in [min, max] (both inclusive).
     */
    public int nextIntInclusive(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min > max: " + min + " > " + max);
        }
        long span = (long) max - min + 1;
        if (span <= Integer.MAX_VALUE) {
            return min + rng.nextInt((int) span);
        }
        return (int) (min + rng.nextLong(span));
    }
    
    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng.nextLong();
    }
    
    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }
    
    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }
    
    /**
     * Returns uniformly distributed boolean.
     */
    public boolean nextBoolean() {
        return rng.nextBoolean();
    }
    
    /**
     * Get initial seed (for logging/debugging).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
}
