package org.tweann.evolution.mutation;

final class MutationRates {

    private MutationRates() {
        // Utility class - no instantiation
    }

    static double requireProbability(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
        }
        return value;
    }
}
