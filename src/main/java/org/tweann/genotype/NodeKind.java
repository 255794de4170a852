package org.tweann.genotype;

/**
 * Role of a node gene inside a genotype.
 */
public enum NodeKind {
    /** Produces a vector signal; never the target of a connection. */
    SENSOR,
    /** Computes an activation over its weighted inputs. */
    NEURON,
    /** Consumes the outputs of its fan-in neurons; never the source of a connection. */
    ACTUATOR,
    /** The single constant source feeding the bias input of every neuron. */
    BIAS
}
