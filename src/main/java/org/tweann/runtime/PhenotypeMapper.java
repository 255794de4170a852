package org.tweann.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import org.tweann.genotype.ActuatorRef;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.InnovationHasher;
import org.tweann.genotype.NodeGene;
import org.tweann.genotype.SensorRef;
import org.tweann.runtime.functions.FunctionBindings;

/**
 * Translates genotypes into network blueprints and writes neuron weight backups back into genotypes.
 * <p>
 * Only enabled, non-recurrent connections are wired. A neuron that cannot be reached from any
 * sensor through such connections would never fire, so it is left out of the phenotype. If one of
 * the neurons feeding an actuator is left out, the actuator could never act and the genotype is
 * rejected as malformed.
 */
public final class PhenotypeMapper {

    private PhenotypeMapper() {
        // Utility class - no instantiation
    }

    /**
     * Builds a network for the genotype without starting it.
     *
     * @throws NetworkConfigurationException if the genotype is malformed or uses unknown functions.
     */
    public static Network instantiate(Genotype genotype, FunctionBindings bindings) {
        return Network.build(toBlueprint(genotype), bindings);
    }

    /**
     * Derives the runnable wiring of a genotype.
     *
     * @param genotype The genotype.
     * @return A blueprint containing every sensor and actuator and the reachable neurons.
     * @throws NetworkConfigurationException if an actuator-adjacent neuron is unreachable or a
     *                                       connection addresses a sensor element that does not exist.
     */
    public static NetworkBlueprint toBlueprint(Genotype genotype) {
        Map<String, Integer> sensorLengths = new HashMap<>();
        List<NetworkBlueprint.SensorNode> sensors = new ArrayList<>();
        for (SensorRef sensor : genotype.getSensors()) {
            sensorLengths.put(sensor.id(), sensor.vectorLength());
            sensors.add(new NetworkBlueprint.SensorNode(sensor.id(), sensor.function(), sensor.vectorLength()));
        }

        Map<String, List<ConnectionGene>> activeInputs = new HashMap<>();
        Map<String, List<String>> activeOutputs = new HashMap<>();
        Map<String, Double> biasByNeuron = new HashMap<>();
        for (ConnectionGene c : genotype.getConnections()) {
            if (c.isBias()) {
                biasByNeuron.put(c.target(), c.enabled() ? c.weight() : 0.0);
                continue;
            }
            if (!c.isActive()) continue;
            activeInputs.computeIfAbsent(c.target(), k -> new ArrayList<>()).add(c);
            activeOutputs.computeIfAbsent(c.source(), k -> new ArrayList<>()).add(c.target());
        }

        Set<String> reachable = reachableFromSensors(sensorLengths.keySet(), activeOutputs);

        for (ActuatorRef actuator : genotype.getActuators()) {
            for (String neuronId : actuator.fanIn()) {
                if (!reachable.contains(neuronId)) {
                    throw new NetworkConfigurationException("Genotype " + genotype.getId() + " is malformed: neuron '"
                            + neuronId + "' feeding actuator '" + actuator.id() + "' has no active input path from a sensor");
                }
            }
        }

        List<NetworkBlueprint.NeuronNode> neurons = new ArrayList<>();
        for (NodeGene node : genotype.getNodes()) {
            if (!node.isNeuron() || !reachable.contains(node.id())) continue;

            Map<String, double[]> weightsBySource = new LinkedHashMap<>();
            for (ConnectionGene c : activeInputs.getOrDefault(node.id(), List.of())) {
                boolean fromSensor = sensorLengths.containsKey(c.source());
                if (!fromSensor && !reachable.contains(c.source())) continue;

                int length = fromSensor ? sensorLengths.get(c.source()) : 1;
                if (c.sourceIndex() >= length) {
                    throw new NetworkConfigurationException("Genotype " + genotype.getId() + " connects element "
                            + c.sourceIndex() + " of '" + c.source() + "', which only has " + length);
                }
                weightsBySource.computeIfAbsent(c.source(), k -> new double[length])[c.sourceIndex()] = c.weight();
            }

            List<NetworkBlueprint.WeightedInput> inputs = new ArrayList<>(weightsBySource.size());
            weightsBySource.forEach((source, weights) -> inputs.add(new NetworkBlueprint.WeightedInput(source, weights)));
            neurons.add(new NetworkBlueprint.NeuronNode(node.id(), node.activation(), inputs,
                    biasByNeuron.getOrDefault(node.id(), 0.0)));
        }

        List<NetworkBlueprint.ActuatorNode> actuators = new ArrayList<>();
        for (ActuatorRef actuator : genotype.getActuators()) {
            actuators.add(new NetworkBlueprint.ActuatorNode(actuator.id(), actuator.function(),
                    actuator.vectorLength(), actuator.fanIn()));
        }

        return new NetworkBlueprint(genotype.getId(), sensors, neurons, actuators);
    }

    /**
     * Writes the neuron weights reported in a run back into the genotype's connection genes.
     * Genes of pruned neurons and weight slots without a gene are left as they are.
     *
     * @param genotype The genotype the network was built from.
     * @param result   The run result carrying the backup.
     * @return The genotype with updated weights.
     */
    public static Genotype applyBackup(Genotype genotype, NetworkResult result) {
        Long2DoubleOpenHashMap weights = new Long2DoubleOpenHashMap();
        for (NeuronWeights neuron : result.backup().values()) {
            for (NetworkBlueprint.WeightedInput input : neuron.inputs()) {
                double[] vector = input.weights();
                for (int i = 0; i < vector.length; i++) {
                    weights.put(InnovationHasher.connectionInnovation(input.source(), neuron.neuronId(), i), vector[i]);
                }
            }
            weights.put(InnovationHasher.connectionInnovation(NodeGene.BIAS_ID, neuron.neuronId(), 0), neuron.bias());
        }
        return genotype.withConnectionWeights(weights);
    }

    private static Set<String> reachableFromSensors(Set<String> sensorIds, Map<String, List<String>> outputs) {
        Set<String> reached = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(sensorIds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : outputs.getOrDefault(current, List.of())) {
                if (reached.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reached;
    }
}
