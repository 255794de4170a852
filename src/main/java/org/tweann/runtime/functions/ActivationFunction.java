package org.tweann.runtime.functions;

import java.util.Locale;

/**
 * Activation functions available to neurons.
 * <p>
 * A neuron resolves its function once, when the network is constructed. The enum constant
 * itself is the lookup table entry; no name-based dispatch happens while signals flow.
 */
public enum ActivationFunction {
    TANH {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }
    },
    SIGMOID {
        @Override
        public double apply(double x) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
    },
    LINEAR {
        @Override
        public double apply(double x) {
            return x;
        }
    },
    RELU {
        @Override
        public double apply(double x) {
            return x > 0.0 ? x : 0.0;
        }
    },
    GAUSSIAN {
        @Override
        public double apply(double x) {
            return Math.exp(-x * x);
        }
    };

    /**
     * Applies the function to the extended dot product (weighted sum plus bias).
     *
     * @param x The neuron's accumulated input.
     * @return The neuron's output signal.
     */
    public abstract double apply(double x);

    /**
     * Resolves a configured function name such as {@code "tanh"} or {@code "SIGMOID"}.
     *
     * @param name The case-insensitive function name.
     * @return The matching activation function.
     * @throws IllegalArgumentException if no function has this name.
     */
    public static ActivationFunction fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown activation function: " + name, e);
        }
    }
}
