package org.tweann.genotype;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class InnovationHasherTest {

    @Test
    void sameConnectionGetsSameInnovation() {
        assertThat(InnovationHasher.connectionInnovation("a", "b", 0))
                .isEqualTo(InnovationHasher.connectionInnovation("a", "b", 0));
    }

    @Test
    void innovationDependsOnEveryComponent() {
        long base = InnovationHasher.connectionInnovation("a", "b", 0);

        assertThat(InnovationHasher.connectionInnovation("b", "a", 0)).isNotEqualTo(base);
        assertThat(InnovationHasher.connectionInnovation("a", "b", 1)).isNotEqualTo(base);
        assertThat(InnovationHasher.connectionInnovation("a", "c", 0)).isNotEqualTo(base);
    }

    @Test
    void lengthPrefixSeparatesAmbiguousConcatenations() {
        assertThat(InnovationHasher.connectionInnovation("ab", "c", 0))
                .isNotEqualTo(InnovationHasher.connectionInnovation("a", "bc", 0));
    }

    @Test
    void innovationsAreNonNegative() {
        for (int i = 0; i < 100; i++) {
            assertThat(InnovationHasher.connectionInnovation("s" + i, "t" + i, i)).isNotNegative();
            assertThat(InnovationHasher.nodeInnovation("n" + i)).isNotNegative();
        }
    }

    @Test
    void splitNodeIdIsDeterministicAndIndependentOfWeight() {
        ConnectionGene gene = ConnectionGene.of("sensor:x:0", "neuron:L1:0", 1, 0.3);
        ConnectionGene reweighted = gene.withWeight(-1.7).withEnabled(false);

        String id = InnovationHasher.splitNodeId(gene);

        assertThat(id).startsWith("neuron:s");
        assertThat(InnovationHasher.splitNodeId(reweighted)).isEqualTo(id);
        assertThat(InnovationHasher.splitNodeId(ConnectionGene.of("sensor:x:0", "neuron:L1:0", 0, 0.3)))
                .isNotEqualTo(id);
    }
}
