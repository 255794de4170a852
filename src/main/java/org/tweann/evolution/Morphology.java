package org.tweann.evolution;

import java.util.List;

import com.typesafe.config.Config;
import org.tweann.runtime.functions.ActivationFunction;

/**
 * Shape of the genotypes a population starts from.
 *
 * @param sensors            Sensor function names.
 * @param actuators          Actuator function names.
 * @param hiddenLayers       Neuron count of each hidden layer; may be empty.
 * @param activation         Activation function of the initial neurons.
 * @param initialWeightRange Initial weights and biases are uniform in {@code [-range, range)}.
 */
public record Morphology(List<String> sensors, List<String> actuators, List<Integer> hiddenLayers,
                         ActivationFunction activation, double initialWeightRange) {

    public Morphology {
        sensors = List.copyOf(sensors);
        actuators = List.copyOf(actuators);
        hiddenLayers = List.copyOf(hiddenLayers);
        if (sensors.isEmpty()) {
            throw new IllegalArgumentException("At least one sensor is required");
        }
        if (actuators.isEmpty()) {
            throw new IllegalArgumentException("At least one actuator is required");
        }
        for (int density : hiddenLayers) {
            if (density <= 0) {
                throw new IllegalArgumentException("Hidden layer sizes must be positive, got: " + hiddenLayers);
            }
        }
        if (initialWeightRange <= 0.0) {
            throw new IllegalArgumentException("initial-weight-range must be positive, got: " + initialWeightRange);
        }
    }

    /**
     * Reads the {@code morphology} sub-tree.
     */
    public static Morphology fromConfig(Config options) {
        return new Morphology(
                options.getStringList("sensors"),
                options.getStringList("actuators"),
                options.hasPath("hidden-layers") ? options.getIntList("hidden-layers") : List.of(),
                options.hasPath("activation")
                        ? ActivationFunction.fromName(options.getString("activation"))
                        : ActivationFunction.TANH,
                options.hasPath("initial-weight-range") ? options.getDouble("initial-weight-range") : 0.5);
    }
}
