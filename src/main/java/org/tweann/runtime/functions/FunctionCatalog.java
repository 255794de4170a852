package org.tweann.runtime.functions;

import java.util.Locale;

import org.tweann.runtime.NetworkConfigurationException;

/**
 * Names and vector lengths of the built-in sensor and actuator functions.
 * <p>
 * Genotype construction consults the catalogue to size sensors and actuators; network construction
 * resolves the names to function instances through {@link FunctionBindings}.
 */
public final class FunctionCatalog {

    /**
     * Built-in signal functions.
     */
    public enum SensorType {
        /** Uniform random values in [0, 1). */
        RNG("rng", 2),
        /** The two operands of the current XOR case. */
        XOR_INPUT("xor_input", 2);

        private final String functionName;
        private final int vectorLength;

        SensorType(String functionName, int vectorLength) {
            this.functionName = functionName;
            this.vectorLength = vectorLength;
        }

        public String functionName() {
            return functionName;
        }

        public int vectorLength() {
            return vectorLength;
        }
    }

    /**
     * Built-in consumer functions.
     */
    public enum ActuatorType {
        /** Logs the output vector. */
        PTS("pts", 1),
        /** The network's answer to the current XOR case. */
        XOR_OUTPUT("xor_output", 1);

        private final String functionName;
        private final int vectorLength;

        ActuatorType(String functionName, int vectorLength) {
            this.functionName = functionName;
            this.vectorLength = vectorLength;
        }

        public String functionName() {
            return functionName;
        }

        public int vectorLength() {
            return vectorLength;
        }
    }

    private FunctionCatalog() {
        // Utility class - no instantiation
    }

    /**
     * Resolves a sensor function name.
     *
     * @param name Function name, case-insensitive.
     * @return The catalogue entry.
     * @throws NetworkConfigurationException if the name is unknown.
     */
    public static SensorType sensor(String name) {
        for (SensorType type : SensorType.values()) {
            if (type.functionName.equals(normalize(name))) {
                return type;
            }
        }
        throw new NetworkConfigurationException("Unknown sensor function: " + name);
    }

    /**
     * Resolves an actuator function name.
     *
     * @param name Function name, case-insensitive.
     * @return The catalogue entry.
     * @throws NetworkConfigurationException if the name is unknown.
     */
    public static ActuatorType actuator(String name) {
        for (ActuatorType type : ActuatorType.values()) {
            if (type.functionName.equals(normalize(name))) {
                return type;
            }
        }
        throw new NetworkConfigurationException("Unknown actuator function: " + name);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
