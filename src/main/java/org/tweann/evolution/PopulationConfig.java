package org.tweann.evolution;

import com.typesafe.config.Config;

/**
 * Population-level evolution parameters.
 *
 * @param size                   Number of genotypes per generation.
 * @param compatibilityThreshold Genotypes closer than this to a species representative join it.
 * @param elitismMinSize         Species with more members than this keep their best member unmodified.
 * @param tournamentSize         Number of members sampled per tournament.
 * @param crossoverRate          Probability that an offspring is produced by crossover.
 * @param stagnationThreshold    Generations without improvement after which a species is flagged.
 */
public record PopulationConfig(int size, double compatibilityThreshold, int elitismMinSize,
                               int tournamentSize, double crossoverRate, int stagnationThreshold) {

    public PopulationConfig {
        if (size <= 0) {
            throw new IllegalArgumentException("population size must be positive, got: " + size);
        }
        if (compatibilityThreshold <= 0.0) {
            throw new IllegalArgumentException("compatibility-threshold must be positive, got: " + compatibilityThreshold);
        }
        if (elitismMinSize < 0) {
            throw new IllegalArgumentException("elitism-min-size must be non-negative, got: " + elitismMinSize);
        }
        if (tournamentSize <= 0) {
            throw new IllegalArgumentException("tournament-size must be positive, got: " + tournamentSize);
        }
        if (crossoverRate < 0.0 || crossoverRate > 1.0) {
            throw new IllegalArgumentException("crossover-rate must be in [0.0, 1.0], got: " + crossoverRate);
        }
        if (stagnationThreshold <= 0) {
            throw new IllegalArgumentException("stagnation-threshold must be positive, got: " + stagnationThreshold);
        }
    }

    /**
     * Reads the {@code population} sub-tree.
     */
    public static PopulationConfig fromConfig(Config options) {
        return new PopulationConfig(
                options.getInt("size"),
                options.hasPath("compatibility-threshold") ? options.getDouble("compatibility-threshold") : 3.0,
                options.hasPath("elitism-min-size") ? options.getInt("elitism-min-size") : 5,
                options.hasPath("tournament-size") ? options.getInt("tournament-size") : 3,
                options.hasPath("crossover-rate") ? options.getDouble("crossover-rate") : 0.75,
                options.hasPath("stagnation-threshold") ? options.getInt("stagnation-threshold") : 15);
    }
}
