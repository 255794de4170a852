package org.tweann.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for evolution and evaluation components.
 * <p>
 * Components receive a provider instead of creating their own {@link Random} so that a run seeded
 * with the same value replays identically. Independent consumers should obtain their own stream
 * through {@link #deriveFor(String, long)} rather than sharing one.
 */
public interface IRandomProvider {

    /**
     * Returns a uniformly distributed int in {@code [0, bound)}.
     *
     * @param bound Exclusive upper bound, must be positive.
     * @return The next value.
     */
    int nextInt(int bound);

    /**
     * Returns a uniformly distributed double in {@code [0.0, 1.0)}.
     *
     * @return The next value.
     */
    double nextDouble();

    /**
     * Returns a {@link Random} view backed by this provider's stream.
     *
     * @return A Random instance; successive calls return the same instance.
     */
    Random asJavaRandom();

    /**
     * Derives an independent, reproducible sub-stream.
     * <p>
     * The derived stream depends only on this provider's seed, the scope and the key, not on how
     * many values have already been drawn.
     *
     * @param scope Name of the consumer, for example {@code "evaluation"}.
     * @param key   Distinguishes instances within the scope.
     * @return A new provider.
     */
    IRandomProvider deriveFor(String scope, long key);
}
