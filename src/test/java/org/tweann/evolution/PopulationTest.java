package org.tweann.evolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.genotype.Genotype;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
class PopulationTest {

    private static final PopulationConfig CONFIG = PopulationConfig.fromConfig(
            GenotypeTestUtils.testConfig().getConfig("population"));

    @Test
    void readsPopulationSettings() {
        assertThat(CONFIG).isEqualTo(new PopulationConfig(12, 3.0, 2, 2, 0.5, 3));
        assertThat(PopulationConfig.fromConfig(ConfigFactory.parseString("size = 8")))
                .isEqualTo(new PopulationConfig(8, 3.0, 5, 3, 0.75, 15));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new PopulationConfig(0, 3.0, 2, 2, 0.5, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("size");
        assertThatThrownBy(() -> new PopulationConfig(4, 3.0, 2, 2, 1.5, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("crossover-rate");
    }

    @Test
    void bestIgnoresUnevaluatedAndPrefersEarliestOnTies() {
        Population population = population(
                GenotypeTestUtils.minimal("a"),
                GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("b"), 0.7),
                GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("c"), 0.7));

        assertThat(population.getBest()).map(Genotype::getId).hasValue("b");
        assertThat(population.getUnevaluated()).extracting(Genotype::getId).containsExactly("a");
    }

    @Test
    void withGenotypesReplacesByIdInOrder() {
        Population population = population(GenotypeTestUtils.minimal("a"), GenotypeTestUtils.minimal("b"));

        Population updated = population.withGenotypes(List.of(
                GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("b"), 0.3)));

        assertThat(updated.getGenotypes()).extracting(Genotype::getId).containsExactly("a", "b");
        assertThat(updated.getGenotype("b")).hasValueSatisfying(g -> assertThat(g.getFitness()).isEqualTo(0.3));
        assertThat(population.getGenotype("b")).hasValueSatisfying(g -> assertThat(g.isEvaluated()).isFalse());
        assertThatThrownBy(() -> population.withGenotypes(List.of(GenotypeTestUtils.minimal("z"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThatThrownBy(() -> population(GenotypeTestUtils.minimal("a"), GenotypeTestUtils.minimal("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    private static Population population(Genotype... genotypes) {
        return new Population(0, List.of(genotypes), List.of(), CONFIG, List.of(), 0);
    }
}
