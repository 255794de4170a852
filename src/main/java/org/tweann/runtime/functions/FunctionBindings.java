package org.tweann.runtime.functions;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.tweann.runtime.NetworkConfigurationException;
import org.tweann.runtime.spi.IActuatorFunction;
import org.tweann.runtime.spi.IRandomProvider;
import org.tweann.runtime.spi.ISensorFunction;

/**
 * Binds sensor and actuator function names to the instances a network invokes.
 * <p>
 * Fitness evaluators create their own bindings per evaluation so that the functions can carry
 * per-episode state (the current input case, the recorded outputs) without sharing it with other
 * evaluations.
 */
public final class FunctionBindings {

    /** The four XOR operand pairs in the order the built-in input function replays them. */
    public static final List<double[]> XOR_INPUTS = List.of(
            new double[]{-1.0, -1.0},
            new double[]{-1.0, 1.0},
            new double[]{1.0, -1.0},
            new double[]{1.0, 1.0});

    private final Map<String, ISensorFunction> sensors;
    private final Map<String, IActuatorFunction> actuators;

    private FunctionBindings(Map<String, ISensorFunction> sensors, Map<String, IActuatorFunction> actuators) {
        this.sensors = Map.copyOf(sensors);
        this.actuators = Map.copyOf(actuators);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns bindings for every catalogue function: {@code rng} draws from the given provider,
     * {@code xor_input} cycles through {@link #XOR_INPUTS}, and both actuators log their vectors.
     *
     * @param random Source for the {@code rng} sensor.
     * @return The default bindings.
     */
    public static FunctionBindings defaults(IRandomProvider random) {
        return builder()
                .sensor(FunctionCatalog.SensorType.RNG.functionName(), new RandomVectorSensor(random))
                .sensor(FunctionCatalog.SensorType.XOR_INPUT.functionName(), new ScriptedInputSensor(XOR_INPUTS))
                .actuator(FunctionCatalog.ActuatorType.PTS.functionName(), new LoggingActuator("pts"))
                .actuator(FunctionCatalog.ActuatorType.XOR_OUTPUT.functionName(), new LoggingActuator("xor_output"))
                .build();
    }

    /**
     * @throws NetworkConfigurationException if no sensor function has this name.
     */
    public ISensorFunction sensor(String name) {
        ISensorFunction function = sensors.get(name);
        if (function == null) {
            throw new NetworkConfigurationException("Unknown sensor function: " + name);
        }
        return function;
    }

    /**
     * @throws NetworkConfigurationException if no actuator function has this name.
     */
    public IActuatorFunction actuator(String name) {
        IActuatorFunction function = actuators.get(name);
        if (function == null) {
            throw new NetworkConfigurationException("Unknown actuator function: " + name);
        }
        return function;
    }

    public static final class Builder {
        private final Map<String, ISensorFunction> sensors = new HashMap<>();
        private final Map<String, IActuatorFunction> actuators = new HashMap<>();

        private Builder() {
        }

        public Builder sensor(String name, ISensorFunction function) {
            sensors.put(name, function);
            return this;
        }

        public Builder actuator(String name, IActuatorFunction function) {
            actuators.put(name, function);
            return this;
        }

        public FunctionBindings build() {
            return new FunctionBindings(sensors, actuators);
        }
    }
}
