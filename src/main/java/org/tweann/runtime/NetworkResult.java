package org.tweann.runtime;

import java.util.Map;

/**
 * Outcome of a completed network run.
 *
 * @param networkId       Id of the network, normally the genotype id.
 * @param cyclesCompleted Number of full sense-think-act cycles.
 * @param terminatedEarly Whether an out-of-band terminate ended the run before the step budget.
 * @param backup          Weights reported by every neuron, keyed by neuron id.
 */
public record NetworkResult(String networkId, int cyclesCompleted, boolean terminatedEarly,
                            Map<String, NeuronWeights> backup) {

    public NetworkResult {
        backup = Map.copyOf(backup);
    }
}
