package org.tweann.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.tweann.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 * <p>
 * Not thread-safe for reproducibility purposes: concurrent consumers must each derive their own
 * provider.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = seed;
        for (byte b : scope.getBytes(StandardCharsets.UTF_8)) {
            h = mix(h ^ b);
        }
        return new SeededRandomProvider(mix(h ^ key));
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return (z ^ (z >>> 31)) + 0x9e3779b97f4a7c15L;
    }
}
