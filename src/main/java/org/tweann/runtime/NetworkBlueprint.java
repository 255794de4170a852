package org.tweann.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.tweann.runtime.functions.ActivationFunction;

/**
 * Static description of a runnable network: which sensors, neurons and actuators exist and how they
 * are wired. Output lists are not stored; the network derives them by inverting neuron inputs and
 * actuator fan-ins, so the two directions cannot disagree.
 * <p>
 * {@link #validate()} rejects every shape the actor protocol cannot run: duplicate ids, dangling
 * references, empty fan-in lists, weight vectors whose length does not match their source, and
 * cycles among neurons (which would deadlock the cycle barrier).
 *
 * @param id        Network id, normally the genotype id.
 * @param sensors   Sensor nodes.
 * @param neurons   Neuron nodes.
 * @param actuators Actuator nodes.
 */
public record NetworkBlueprint(String id, List<SensorNode> sensors, List<NeuronNode> neurons,
                               List<ActuatorNode> actuators) {

    public NetworkBlueprint {
        Objects.requireNonNull(id, "id");
        sensors = List.copyOf(sensors);
        neurons = List.copyOf(neurons);
        actuators = List.copyOf(actuators);
    }

    /**
     * @param id           Sensor id.
     * @param function     Name of the signal function.
     * @param vectorLength Length of each sampled vector.
     */
    public record SensorNode(String id, String function, int vectorLength) {
    }

    /**
     * One weighted input of a neuron. The weight vector has one entry per element of the source
     * signal.
     *
     * @param source  Id of the sensor or neuron feeding this input.
     * @param weights Weights applied element-wise to the source signal.
     */
    public record WeightedInput(String source, double[] weights) {
        public WeightedInput {
            Objects.requireNonNull(source, "source");
            weights = weights.clone();
        }

        /**
         * Returns a copy of the weight vector.
         */
        @Override
        public double[] weights() {
            return weights.clone();
        }

        double dot(double[] signal) {
            double sum = 0.0;
            for (int i = 0; i < weights.length; i++) {
                sum += signal[i] * weights[i];
            }
            return sum;
        }

        int length() {
            return weights.length;
        }
    }

    /**
     * @param id         Neuron id.
     * @param activation Activation function applied to the weighted sum plus bias.
     * @param inputs     Weighted inputs in a fixed order.
     * @param bias       Bias weight.
     */
    public record NeuronNode(String id, ActivationFunction activation, List<WeightedInput> inputs, double bias) {
        public NeuronNode {
            inputs = List.copyOf(inputs);
        }
    }

    /**
     * @param id           Actuator id.
     * @param function     Name of the consumer function.
     * @param vectorLength Length of the actuation vector; equals the fan-in size.
     * @param fanIn        Ordered ids of the neurons feeding the actuator.
     */
    public record ActuatorNode(String id, String function, int vectorLength, List<String> fanIn) {
        public ActuatorNode {
            fanIn = List.copyOf(fanIn);
        }
    }

    /**
     * Checks the structural invariants required to run this network.
     *
     * @throws NetworkConfigurationException describing the first violation found.
     */
    public void validate() {
        if (sensors.isEmpty()) {
            throw new NetworkConfigurationException("Network " + id + " has no sensors");
        }
        if (actuators.isEmpty()) {
            throw new NetworkConfigurationException("Network " + id + " has no actuators");
        }

        Set<String> ids = new HashSet<>();
        Map<String, Integer> sensorLengths = new HashMap<>();
        Map<String, NeuronNode> neuronsById = new HashMap<>();
        for (SensorNode sensor : sensors) {
            requireUnique(ids, sensor.id());
            if (sensor.vectorLength() <= 0) {
                throw new NetworkConfigurationException("Sensor '" + sensor.id() + "' has non-positive vector length");
            }
            sensorLengths.put(sensor.id(), sensor.vectorLength());
        }
        for (NeuronNode neuron : neurons) {
            requireUnique(ids, neuron.id());
            neuronsById.put(neuron.id(), neuron);
        }
        for (ActuatorNode actuator : actuators) {
            requireUnique(ids, actuator.id());
        }

        for (NeuronNode neuron : neurons) {
            if (neuron.activation() == null) {
                throw new NetworkConfigurationException("Neuron '" + neuron.id() + "' has no activation function");
            }
            if (neuron.inputs().isEmpty()) {
                throw new NetworkConfigurationException("Neuron '" + neuron.id() + "' has an empty fan-in list");
            }
            Set<String> seen = new HashSet<>();
            for (WeightedInput input : neuron.inputs()) {
                if (!seen.add(input.source())) {
                    throw new NetworkConfigurationException("Neuron '" + neuron.id() + "' lists input '"
                            + input.source() + "' twice");
                }
                int expected;
                if (sensorLengths.containsKey(input.source())) {
                    expected = sensorLengths.get(input.source());
                } else if (neuronsById.containsKey(input.source())) {
                    expected = 1;
                } else {
                    throw new NetworkConfigurationException("Neuron '" + neuron.id() + "' refers to unknown input '"
                            + input.source() + "'");
                }
                if (input.length() != expected) {
                    throw new NetworkConfigurationException("Neuron '" + neuron.id() + "' has " + input.length()
                            + " weights for input '" + input.source() + "', expected " + expected);
                }
            }
        }

        for (ActuatorNode actuator : actuators) {
            if (actuator.fanIn().isEmpty()) {
                throw new NetworkConfigurationException("Actuator '" + actuator.id() + "' has an empty fan-in list");
            }
            if (actuator.fanIn().size() != actuator.vectorLength()) {
                throw new NetworkConfigurationException("Actuator '" + actuator.id() + "' has vector length "
                        + actuator.vectorLength() + " but " + actuator.fanIn().size() + " fan-in neurons");
            }
            Set<String> seen = new HashSet<>();
            for (String neuronId : actuator.fanIn()) {
                if (!neuronsById.containsKey(neuronId)) {
                    throw new NetworkConfigurationException("Actuator '" + actuator.id()
                            + "' refers to unknown neuron '" + neuronId + "'");
                }
                if (!seen.add(neuronId)) {
                    throw new NetworkConfigurationException("Actuator '" + actuator.id() + "' lists neuron '"
                            + neuronId + "' twice");
                }
            }
        }

        requireAcyclic(neuronsById);
    }

    private void requireUnique(Set<String> ids, String nodeId) {
        if (nodeId == null || !ids.add(nodeId)) {
            throw new NetworkConfigurationException("Network " + id + " has duplicate or missing node id '" + nodeId + "'");
        }
    }

    // Iterative DFS with white/grey/black marking over neuron-to-neuron edges.
    private void requireAcyclic(Map<String, NeuronNode> neuronsById) {
        Map<String, Integer> state = new HashMap<>();
        for (NeuronNode start : neurons) {
            if (state.getOrDefault(start.id(), 0) != 0) continue;
            Deque<String> stack = new ArrayDeque<>();
            Deque<Integer> cursor = new ArrayDeque<>();
            stack.push(start.id());
            cursor.push(0);
            state.put(start.id(), 1);
            while (!stack.isEmpty()) {
                NeuronNode current = neuronsById.get(stack.peek());
                int next = cursor.pop();
                if (next < current.inputs().size()) {
                    cursor.push(next + 1);
                    String source = current.inputs().get(next).source();
                    if (!neuronsById.containsKey(source)) continue;
                    int s = state.getOrDefault(source, 0);
                    if (s == 1) {
                        throw new NetworkConfigurationException("Network " + id + " has a cycle through neuron '"
                                + source + "'");
                    }
                    if (s == 0) {
                        state.put(source, 1);
                        stack.push(source);
                        cursor.push(0);
                    }
                } else {
                    state.put(stack.pop(), 2);
                }
            }
        }
    }
}
