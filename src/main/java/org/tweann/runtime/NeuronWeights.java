package org.tweann.runtime;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one neuron's weights as reported during backup collection.
 *
 * @param neuronId Id of the reporting neuron.
 * @param inputs   Weighted inputs in the neuron's declared order.
 * @param bias     Bias weight.
 */
public record NeuronWeights(String neuronId, List<NetworkBlueprint.WeightedInput> inputs, double bias) {

    public NeuronWeights {
        Objects.requireNonNull(neuronId, "neuronId");
        inputs = List.copyOf(inputs);
    }
}
