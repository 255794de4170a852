package org.tweann.evolution.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Flips the enabled flag of one connection.
 * <p>
 * With probability {@code rate}, picks uniformly among the non-bias connections that may be
 * toggled: every disabled connection, and every enabled connection except the only enabled,
 * non-recurrent input of its target.
 */
public class ToggleConnectionMutation implements IMutationOperator {

    private final Random random;
    private final double rate;

    /**
     * Creates the operator from configuration.
     *
     * @param randomProvider Source of randomness.
     * @param options        Configuration containing {@code rate}.
     */
    public ToggleConnectionMutation(IRandomProvider randomProvider, Config options) {
        this(randomProvider, options.getDouble("rate"));
    }

    ToggleConnectionMutation(IRandomProvider randomProvider, double rate) {
        this.random = randomProvider.asJavaRandom();
        this.rate = MutationRates.requireProbability("rate", rate);
    }

    @Override
    public Genotype mutate(Genotype genotype) {
        if (random.nextDouble() >= rate) {
            return genotype;
        }

        Object2IntOpenHashMap<String> activeInputs = new Object2IntOpenHashMap<>();
        for (ConnectionGene c : genotype.getConnections()) {
            if (c.isActive() && !c.isBias()) {
                activeInputs.addTo(c.target(), 1);
            }
        }

        List<ConnectionGene> eligible = new ArrayList<>();
        for (ConnectionGene c : genotype.getConnections()) {
            if (c.isBias()) continue;
            if (!c.enabled() || c.recurrent() || activeInputs.getInt(c.target()) > 1) {
                eligible.add(c);
            }
        }
        if (eligible.isEmpty()) {
            return genotype;
        }

        ConnectionGene chosen = eligible.get(random.nextInt(eligible.size()));
        List<ConnectionGene> updated = new ArrayList<>(genotype.getConnections().size());
        for (ConnectionGene c : genotype.getConnections()) {
            updated.add(c.innovation() == chosen.innovation() ? c.withEnabled(!c.enabled()) : c);
        }
        return genotype.toBuilder().connections(updated).build();
    }
}
