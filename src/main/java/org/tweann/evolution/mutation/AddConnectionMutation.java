package org.tweann.evolution.mutation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.InnovationHasher;
import org.tweann.genotype.NodeGene;
import org.tweann.genotype.SensorRef;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Adds a connection between two nodes that are not yet connected.
 * <p>
 * With probability {@code rate}, enumerates every {@code (source, sourceIndex, target)} triple
 * where the source is a sensor element or a neuron, the target is a different neuron and no gene
 * for the triple exists yet, and adds one chosen uniformly with a weight in
 * {@code [-weight-range, weight-range)}. A connection that would close a cycle through the
 * non-recurrent connections is added with its recurrent flag set and is never wired into a
 * phenotype.
 */
public class AddConnectionMutation implements IMutationOperator {

    private final Random random;
    private final double rate;
    private final double weightRange;

    /**
     * Creates the operator from configuration.
     *
     * @param randomProvider Source of randomness.
     * @param options        Configuration containing {@code rate} and optionally {@code weight-range}.
     */
    public AddConnectionMutation(IRandomProvider randomProvider, Config options) {
        this(randomProvider, options.getDouble("rate"),
                options.hasPath("weight-range") ? options.getDouble("weight-range") : 2.0);
    }

    AddConnectionMutation(IRandomProvider randomProvider, double rate, double weightRange) {
        this.random = randomProvider.asJavaRandom();
        this.rate = MutationRates.requireProbability("rate", rate);
        if (weightRange <= 0.0) {
            throw new IllegalArgumentException("weight-range must be positive, got: " + weightRange);
        }
        this.weightRange = weightRange;
    }

    @Override
    public Genotype mutate(Genotype genotype) {
        if (random.nextDouble() >= rate) {
            return genotype;
        }

        LongOpenHashSet existing = new LongOpenHashSet();
        for (ConnectionGene c : genotype.getConnections()) {
            existing.add(c.innovation());
        }

        List<String> neurons = new ArrayList<>();
        for (NodeGene node : genotype.getNodes()) {
            if (node.isNeuron()) {
                neurons.add(node.id());
            }
        }

        List<ConnectionGene> candidates = new ArrayList<>();
        for (SensorRef sensor : genotype.getSensors()) {
            for (int index = 0; index < sensor.vectorLength(); index++) {
                for (String target : neurons) {
                    addCandidate(candidates, existing, sensor.id(), target, index);
                }
            }
        }
        for (String source : neurons) {
            for (String target : neurons) {
                if (!source.equals(target)) {
                    addCandidate(candidates, existing, source, target, 0);
                }
            }
        }
        if (candidates.isEmpty()) {
            return genotype;
        }

        ConnectionGene chosen = candidates.get(random.nextInt(candidates.size()));
        double weight = (random.nextDouble() * 2.0 - 1.0) * weightRange;
        ConnectionGene gene = chosen.withWeight(weight)
                .withRecurrent(closesCycle(genotype, chosen.source(), chosen.target()));
        return genotype.toBuilder().connection(gene).build();
    }

    private static void addCandidate(List<ConnectionGene> candidates, LongOpenHashSet existing,
                                     String source, String target, int index) {
        long innovation = InnovationHasher.connectionInnovation(source, target, index);
        if (!existing.contains(innovation)) {
            candidates.add(new ConnectionGene(source, target, index, 0.0, true, innovation, false));
        }
    }

    /**
     * Returns whether {@code source} is reachable from {@code target} through non-recurrent
     * connections, enabled or not. Disabled genes count because toggling may re-enable them.
     */
    static boolean closesCycle(Genotype genotype, String source, String target) {
        if (source.equals(target)) {
            return true;
        }
        Map<String, List<String>> outputs = new HashMap<>();
        for (ConnectionGene c : genotype.getConnections()) {
            if (!c.recurrent()) {
                outputs.computeIfAbsent(c.source(), k -> new ArrayList<>()).add(c.target());
            }
        }
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(target);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(source)) {
                return true;
            }
            if (visited.add(current)) {
                for (String next : outputs.getOrDefault(current, List.of())) {
                    stack.push(next);
                }
            }
        }
        return false;
    }
}
