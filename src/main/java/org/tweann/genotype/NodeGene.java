package org.tweann.genotype;

import java.util.Objects;

import org.tweann.runtime.functions.ActivationFunction;

/**
 * An immutable node gene.
 *
 * @param id         Stable node id, shared by every genotype that contains the same structural node.
 * @param kind       The node's role.
 * @param activation Activation function for neurons, {@code null} for all other kinds.
 * @param layer      Layer index (0 for sensors and bias, {@link #OUTPUT_LAYER} for actuators).
 * @param innovation Historical marker derived from the id.
 */
public record NodeGene(String id, NodeKind kind, ActivationFunction activation, int layer, long innovation) {

    /** Layer index assigned to actuator nodes. */
    public static final int OUTPUT_LAYER = Integer.MAX_VALUE;

    /** Id of the bias node present in every genotype. */
    public static final String BIAS_ID = "bias";

    public NodeGene {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (kind == NodeKind.NEURON && activation == null) {
            throw new IllegalArgumentException("Neuron node '" + id + "' requires an activation function");
        }
    }

    public static NodeGene sensor(String id) {
        return new NodeGene(id, NodeKind.SENSOR, null, 0, InnovationHasher.nodeInnovation(id));
    }

    public static NodeGene actuator(String id) {
        return new NodeGene(id, NodeKind.ACTUATOR, null, OUTPUT_LAYER, InnovationHasher.nodeInnovation(id));
    }

    public static NodeGene bias() {
        return new NodeGene(BIAS_ID, NodeKind.BIAS, null, 0, InnovationHasher.nodeInnovation(BIAS_ID));
    }

    public static NodeGene neuron(String id, ActivationFunction activation, int layer) {
        return new NodeGene(id, NodeKind.NEURON, activation, layer, InnovationHasher.nodeInnovation(id));
    }

    public boolean isNeuron() {
        return kind == NodeKind.NEURON;
    }
}
