package org.tweann.evolution.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.InnovationHasher;
import org.tweann.genotype.NodeGene;
import org.tweann.runtime.functions.ActivationFunction;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Splits a connection by inserting a neuron.
 * <p>
 * With probability {@code rate}, picks a random enabled, non-recurrent, non-bias connection
 * {@code in -> out}, disables it and adds a neuron {@code n} with the connections
 * {@code in -> n} (weight 1.0), {@code n -> out} (the original weight) and a zero bias input. The
 * id of {@code n} is derived from the split connection, so splitting the same connection in two
 * genotypes produces the same node and the same innovation numbers. If the derived neuron already
 * exists the mutation is skipped.
 */
public class AddNodeMutation implements IMutationOperator {

    private static final Logger log = LoggerFactory.getLogger(AddNodeMutation.class);

    private final Random random;
    private final double rate;
    private final ActivationFunction activation;

    /**
     * Creates the operator from configuration.
     *
     * @param randomProvider Source of randomness.
     * @param options        Configuration containing {@code rate} and optionally {@code activation}.
     */
    public AddNodeMutation(IRandomProvider randomProvider, Config options) {
        this(randomProvider, options.getDouble("rate"),
                options.hasPath("activation")
                        ? ActivationFunction.fromName(options.getString("activation"))
                        : ActivationFunction.TANH);
    }

    AddNodeMutation(IRandomProvider randomProvider, double rate, ActivationFunction activation) {
        this.random = randomProvider.asJavaRandom();
        this.rate = MutationRates.requireProbability("rate", rate);
        this.activation = activation;
    }

    @Override
    public Genotype mutate(Genotype genotype) {
        if (random.nextDouble() >= rate) {
            return genotype;
        }
        List<ConnectionGene> candidates = new ArrayList<>();
        for (ConnectionGene c : genotype.getConnections()) {
            if (c.isActive() && !c.isBias()) {
                candidates.add(c);
            }
        }
        if (candidates.isEmpty()) {
            return genotype;
        }
        return split(genotype, candidates.get(random.nextInt(candidates.size())));
    }

    /**
     * Inserts a neuron into the given connection.
     *
     * @param genotype The genotype containing {@code target}.
     * @param target   The connection to split.
     * @return The mutated genotype, or {@code genotype} if the split neuron already exists.
     */
    Genotype split(Genotype genotype, ConnectionGene target) {
        String neuronId = InnovationHasher.splitNodeId(target);
        if (genotype.findNode(neuronId).isPresent()) {
            log.debug("Skipping add-node on genotype {}: neuron {} already exists", genotype.getId(), neuronId);
            return genotype;
        }

        int sourceLayer = genotype.findNode(target.source()).map(NodeGene::layer).orElse(0);
        int targetLayer = genotype.findNode(target.target()).map(NodeGene::layer).orElse(sourceLayer);
        int layer = (int) (((long) sourceLayer + targetLayer) / 2);

        List<ConnectionGene> connections = new ArrayList<>(genotype.getConnections().size() + 3);
        for (ConnectionGene c : genotype.getConnections()) {
            connections.add(c.innovation() == target.innovation() ? c.withEnabled(false) : c);
        }
        connections.add(ConnectionGene.of(target.source(), neuronId, target.sourceIndex(), 1.0));
        connections.add(ConnectionGene.of(neuronId, target.target(), 0, target.weight()));
        connections.add(ConnectionGene.of(NodeGene.BIAS_ID, neuronId, 0, 0.0));

        return genotype.toBuilder()
                .node(NodeGene.neuron(neuronId, activation, layer))
                .connections(connections)
                .build();
    }
}
