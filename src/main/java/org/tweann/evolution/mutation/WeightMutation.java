package org.tweann.evolution.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Perturbs or replaces connection weights.
 * <p>
 * Every enabled connection, bias inputs included, is selected independently with probability
 * {@code rate}. A selected weight is shifted by a uniform delta in
 * {@code [-perturbation-power, perturbation-power)} with probability {@code perturbation-rate};
 * otherwise it is replaced by a uniform value in {@code [-weight-range, weight-range)}.
 */
public class WeightMutation implements IMutationOperator {

    private final Random random;
    private final double rate;
    private final double perturbationRate;
    private final double perturbationPower;
    private final double weightRange;

    /**
     * Creates the operator from configuration.
     *
     * @param randomProvider Source of randomness.
     * @param options        Configuration containing {@code rate}, {@code perturbation-rate},
     *                       {@code perturbation-power} and {@code weight-range}.
     */
    public WeightMutation(IRandomProvider randomProvider, Config options) {
        this(randomProvider,
                options.getDouble("rate"),
                options.hasPath("perturbation-rate") ? options.getDouble("perturbation-rate") : 0.9,
                options.hasPath("perturbation-power") ? options.getDouble("perturbation-power") : 0.5,
                options.hasPath("weight-range") ? options.getDouble("weight-range") : 2.0);
    }

    WeightMutation(IRandomProvider randomProvider, double rate, double perturbationRate,
                   double perturbationPower, double weightRange) {
        this.random = randomProvider.asJavaRandom();
        this.rate = MutationRates.requireProbability("rate", rate);
        this.perturbationRate = MutationRates.requireProbability("perturbation-rate", perturbationRate);
        if (perturbationPower < 0.0) {
            throw new IllegalArgumentException("perturbation-power must be non-negative, got: " + perturbationPower);
        }
        if (weightRange <= 0.0) {
            throw new IllegalArgumentException("weight-range must be positive, got: " + weightRange);
        }
        this.perturbationPower = perturbationPower;
        this.weightRange = weightRange;
    }

    @Override
    public Genotype mutate(Genotype genotype) {
        List<ConnectionGene> connections = genotype.getConnections();
        List<ConnectionGene> updated = new ArrayList<>(connections.size());
        boolean changed = false;
        for (ConnectionGene c : connections) {
            if (c.enabled() && random.nextDouble() < rate) {
                double weight = random.nextDouble() < perturbationRate
                        ? c.weight() + (random.nextDouble() * 2.0 - 1.0) * perturbationPower
                        : (random.nextDouble() * 2.0 - 1.0) * weightRange;
                updated.add(c.withWeight(weight));
                changed = true;
            } else {
                updated.add(c);
            }
        }
        return changed ? genotype.toBuilder().connections(updated).build() : genotype;
    }
}
