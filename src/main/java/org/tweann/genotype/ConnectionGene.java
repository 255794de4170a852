package org.tweann.genotype;

import java.util.Objects;

/**
 * An immutable connection gene.
 * <p>
 * {@code sourceIndex} selects the element of a vector-valued source signal this weight applies to.
 * Sensors emit vectors, so a sensor feeding a neuron contributes one gene per element; neurons
 * and the bias node emit scalars and always use index 0.
 * <p>
 * The innovation number is a pure function of {@code (source, target, sourceIndex)}, see
 * {@link InnovationHasher#connectionInnovation(String, String, int)}.
 *
 * @param source      Source node id.
 * @param target      Target node id.
 * @param sourceIndex Element index within the source signal.
 * @param weight      Connection weight.
 * @param enabled     Whether the connection is expressed in the phenotype.
 * @param innovation  Historical marker.
 * @param recurrent   Whether the connection closes a cycle. Recurrent connections are never wired.
 */
public record ConnectionGene(String source, String target, int sourceIndex, double weight,
                             boolean enabled, long innovation, boolean recurrent) {

    public ConnectionGene {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (sourceIndex < 0) {
            throw new IllegalArgumentException("sourceIndex must be non-negative, got: " + sourceIndex);
        }
    }

    /**
     * Creates an enabled, feed-forward connection with its innovation number derived from its endpoints.
     */
    public static ConnectionGene of(String source, String target, int sourceIndex, double weight) {
        return new ConnectionGene(source, target, sourceIndex, weight, true,
                InnovationHasher.connectionInnovation(source, target, sourceIndex), false);
    }

    public ConnectionGene withWeight(double newWeight) {
        return new ConnectionGene(source, target, sourceIndex, newWeight, enabled, innovation, recurrent);
    }

    public ConnectionGene withEnabled(boolean newEnabled) {
        return new ConnectionGene(source, target, sourceIndex, weight, newEnabled, innovation, recurrent);
    }

    public ConnectionGene withRecurrent(boolean newRecurrent) {
        return new ConnectionGene(source, target, sourceIndex, weight, enabled, innovation, newRecurrent);
    }

    /**
     * Returns whether this gene carries the bias input of its target neuron.
     */
    public boolean isBias() {
        return NodeGene.BIAS_ID.equals(source);
    }

    /**
     * Returns whether the gene is wired into a phenotype: enabled and not recurrent.
     */
    public boolean isActive() {
        return enabled && !recurrent;
    }
}
