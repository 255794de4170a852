package org.tweann.evolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.NodeGene;
import org.tweann.runtime.PhenotypeMapper;
import org.tweann.runtime.functions.ActivationFunction;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
class GeneticOperatorsTest {

    private static GeneticOperators operators(long seed) {
        return new GeneticOperators(new SeededRandomProvider(seed), GenotypeTestUtils.testConfig());
    }

    private static GeneticOperators crossoverOnly(long seed) {
        return new GeneticOperators(List.of(), new CompatibilityDistance(1.0, 1.0, 0.4, 20), new Random(seed));
    }

    @Test
    void childSizeIsBoundedByParents() {
        Genotype a = GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("a"), 0.9);
        Genotype b = GenotypeTestUtils.evaluated(withExtraNeuron(GenotypeTestUtils.minimal("b", 0.1, 0.2, 0.3)), 0.4);

        for (long seed = 0; seed < 10; seed++) {
            Genotype child = crossoverOnly(seed).crossover(a, b, "child");

            assertThat(child.getConnections().size())
                    .isBetween(a.getConnections().size(), a.getConnections().size() + b.getConnections().size());
            assertThat(child.getId()).isEqualTo("child");
            assertThat(child.isEvaluated()).isFalse();
            assertThatCode(() -> PhenotypeMapper.toBlueprint(child)).doesNotThrowAnyException();
        }
    }

    @Test
    void unmatchedGenesComeFromFitterParentOnly() {
        Genotype weak = GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("weak"), 0.1);
        Genotype strong = GenotypeTestUtils.evaluated(withExtraNeuron(GenotypeTestUtils.minimal("strong")), 0.8);

        Genotype child = crossoverOnly(1).crossover(weak, strong, "child");

        Set<Long> strongInnovations = new HashSet<>();
        strong.getConnections().forEach(c -> strongInnovations.add(c.innovation()));
        assertThat(child.getConnections()).extracting(ConnectionGene::innovation)
                .containsExactlyInAnyOrderElementsOf(strongInnovations);
        assertThat(child.findNode("neuron:L1:extra")).isPresent();
    }

    @Test
    void weakerParentNodesKeepTheirBiasGene() {
        Genotype strong = GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("strong"), 0.9);
        Genotype weak = GenotypeTestUtils.evaluated(withExtraNeuron(GenotypeTestUtils.minimal("weak")), 0.2);

        Genotype child = crossoverOnly(2).crossover(strong, weak, "child");

        assertThat(child.findNode("neuron:L1:extra")).isPresent();
        assertThat(child.getConnections())
                .filteredOn(c -> c.target().equals("neuron:L1:extra"))
                .singleElement()
                .satisfies(c -> assertThat(c.isBias()).isTrue());
        assertThat(PhenotypeMapper.toBlueprint(child).neurons()).extracting(n -> n.id())
                .doesNotContain("neuron:L1:extra");
    }

    @Test
    void matchingWeightsComeFromEitherParent() {
        Genotype a = GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("a", 1.0, 1.0, 1.0), 0.5);
        Genotype b = GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("b", -1.0, -1.0, -1.0), 0.5);
        Set<Double> seen = new HashSet<>();

        GeneticOperators operators = crossoverOnly(3);
        for (int i = 0; i < 10; i++) {
            Genotype child = operators.crossover(a, b, "c" + i);
            child.getConnections().forEach(c -> seen.add(c.weight()));
        }

        assertThat(seen).containsExactlyInAnyOrder(1.0, -1.0);
    }

    @Test
    void recurrentFlagSurvivesCrossover() {
        Genotype base = GenotypeTestUtils.hidden("a");
        ConnectionGene back = ConnectionGene.of("neuron:L2:0", "neuron:L1:0", 0, 0.3);
        Genotype a = GenotypeTestUtils.evaluated(base.toBuilder().connection(back.withRecurrent(true)).build(), 0.5);
        Genotype b = GenotypeTestUtils.evaluated(
                GenotypeTestUtils.hidden("b").toBuilder().connection(back).build(), 0.1);

        Genotype child = crossoverOnly(4).crossover(a, b, "child");

        assertThat(child.getConnections()).filteredOn(c -> c.innovation() == back.innovation())
                .singleElement()
                .satisfies(c -> assertThat(c.recurrent()).isTrue());
    }

    @Test
    void distanceIsSymmetric() {
        GeneticOperators operators = operators(5);
        Genotype a = GenotypeTestUtils.hidden("a");
        Genotype b = withExtraNeuron(GenotypeTestUtils.minimal("b"));

        assertThat(operators.distance(a, b)).isEqualTo(operators.distance(b, a));
        assertThat(operators.distance(a, a)).isZero();
    }

    @Test
    void mutationIsReproducibleForFixedSeed() {
        Genotype genotype = GenotypeTestUtils.hidden("g");
        GeneticOperators first = operators(6);
        GeneticOperators second = operators(6);

        for (int i = 0; i < 5; i++) {
            assertThat(first.mutate(genotype)).isEqualTo(second.mutate(genotype));
        }
    }

    @Test
    void mutatedGenotypesStayRunnable() {
        GeneticOperators operators = operators(7);
        Genotype current = GenotypeTestUtils.minimal("g");

        for (int i = 0; i < 50; i++) {
            current = operators.mutate(current);
            Genotype snapshot = current;
            assertThatCode(() -> PhenotypeMapper.toBlueprint(snapshot).validate()).doesNotThrowAnyException();
        }
    }

    private static Genotype withExtraNeuron(Genotype genotype) {
        String extra = "neuron:L1:extra";
        return genotype.toBuilder()
                .node(NodeGene.neuron(extra, ActivationFunction.TANH, 1))
                .connection(ConnectionGene.of(GenotypeTestUtils.SENSOR, extra, 0, 0.6))
                .connection(ConnectionGene.of(NodeGene.BIAS_ID, extra, 0, 0.2))
                .connection(ConnectionGene.of(extra, GenotypeTestUtils.OUTPUT, 0, 0.7))
                .build();
    }
}
