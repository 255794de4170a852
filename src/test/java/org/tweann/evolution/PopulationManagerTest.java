package org.tweann.evolution;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
class PopulationManagerTest {

    private static final int SIZE = 12;

    private static PopulationManager manager(double threshold, int elitismMinSize, int stagnationThreshold, long seed) {
        Config config = GenotypeTestUtils.testConfig();
        SeededRandomProvider random = new SeededRandomProvider(seed);
        PopulationConfig populationConfig = new PopulationConfig(SIZE, threshold, elitismMinSize, 2, 0.5,
                stagnationThreshold);
        return new PopulationManager(populationConfig,
                new GenotypeConstructor(Morphology.fromConfig(config.getConfig("morphology"))),
                new GeneticOperators(random, config), random);
    }

    private static Population evaluate(Population population, ToDoubleFunction<Genotype> fitness) {
        List<Genotype> evaluated = new ArrayList<>();
        for (Genotype genotype : population.getGenotypes()) {
            evaluated.add(genotype.isEvaluated() ? genotype
                    : GenotypeTestUtils.evaluated(genotype, fitness.applyAsDouble(genotype)));
        }
        return population.withGenotypes(evaluated);
    }

    @Test
    void initialPopulationIsPartitionedIntoSpecies() {
        Population population = manager(3.0, 2, 3, 1).initialize();

        assertThat(population.getGeneration()).isZero();
        assertThat(population.size()).isEqualTo(SIZE);
        assertThat(population.getUnevaluated()).hasSize(SIZE);
        assertPartition(population);
    }

    @Test
    void thresholdControlsSpeciesCount() {
        assertThat(manager(1e-9, 2, 3, 1).initialize().getSpecies()).hasSize(SIZE);
        assertThat(manager(100.0, 2, 3, 1).initialize().getSpecies()).hasSize(1);
    }

    @Test
    void adjustedFitnessIsSharedWithinSpecies() {
        PopulationManager manager = manager(100.0, 2, 3, 2);
        Population population = evaluate(manager.initialize(), g -> 6.0);

        Population speciated = manager.speciate(population);

        assertThat(speciated.getGenotypes())
                .allSatisfy(g -> assertThat(g.getAdjustedFitness()).isEqualTo(6.0 / SIZE));
    }

    @Test
    void everyGenerationKeepsExactSizeAndPartition() {
        PopulationManager manager = manager(0.5, 2, 3, 3);
        Population population = manager.initialize();

        for (int generation = 0; generation < 4; generation++) {
            Population evaluated = evaluate(population, g -> Math.abs(g.getConnections().get(0).weight()));
            population = manager.nextGeneration(evaluated);

            assertThat(population.getGeneration()).isEqualTo(generation + 1);
            assertThat(population.size()).isEqualTo(SIZE);
            assertThat(population.getHistory()).hasSize(generation + 1);
            assertPartition(population);
        }
    }

    @Test
    void zeroFitnessAllocatesUniformly() {
        PopulationManager manager = manager(1e-9, 2, 3, 4);
        Population population = manager.speciate(evaluate(manager.initialize(), g -> 0.0));
        List<Species> four = population.getSpecies().subList(0, 4);

        assertThat(manager.allocateOffspring(population, four)).containsExactly(3, 3, 3, 3);
    }

    @Test
    void offspringFollowMeanFitness() {
        PopulationManager manager = manager(1e-9, 2, 3, 5);
        Population initial = manager.initialize();
        String favourite = initial.getSpecies().get(0).members().get(0);
        Population population = manager.speciate(
                evaluate(initial, g -> g.getId().equals(favourite) ? 1.0 : 0.0));

        int[] allocation = manager.allocateOffspring(population, population.getSpecies());

        assertThat(allocation[0]).isEqualTo(SIZE);
        for (int s = 1; s < allocation.length; s++) {
            assertThat(allocation[s]).isZero();
        }
    }

    @Test
    void bestMemberOfLargeSpeciesSurvivesUnchanged() {
        PopulationManager manager = manager(100.0, 2, 3, 6);
        Population initial = manager.initialize();
        String championId = initial.getGenotypes().get(5).getId();
        Population evaluated = evaluate(initial, g -> g.getId().equals(championId) ? 1.0 : 0.1);

        Population next = manager.nextGeneration(evaluated);

        assertThat(next.getGenotype(championId)).hasValueSatisfying(champion -> {
            assertThat(champion.getFitness()).isEqualTo(1.0);
            assertThat(champion.isEvaluated()).isTrue();
        });
        assertThat(next.getUnevaluated()).hasSize(SIZE - 1);
    }

    @Test
    void smallSpeciesHaveNoElite() {
        PopulationManager manager = manager(100.0, SIZE, 3, 7);
        Population evaluated = evaluate(manager.initialize(), g -> 0.5);

        Population next = manager.nextGeneration(evaluated);

        assertThat(next.getUnevaluated()).hasSize(SIZE);
        assertThat(next.getGenotypes()).extracting(Genotype::getId).allMatch(id -> id.startsWith("g-1-"));
    }

    @Test
    void speciesWithoutImprovementIsFlaggedStagnant() {
        PopulationManager manager = manager(100.0, 2, 1, 8);
        Population first = manager.nextGeneration(evaluate(manager.initialize(), g -> 1.0));
        String speciesId = first.getSpecies().get(0).id();

        Population second = manager.nextGeneration(evaluate(first, g -> 1.0));

        assertThat(second.getHistory().get(0).stagnantSpecies()).isEmpty();
        assertThat(second.getHistory().get(1).stagnantSpecies()).containsExactly(speciesId);
        assertThat(second.getSpecies().get(0).age()).isEqualTo(2);
    }

    @Test
    void tournamentWithFullSampleReturnsFittest() {
        PopulationManager manager = manager(3.0, 2, 3, 9);
        List<Genotype> members = List.of(
                GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("a"), 0.2),
                GenotypeTestUtils.evaluated(GenotypeTestUtils.minimal("b"), 0.9));

        for (int i = 0; i < 10; i++) {
            assertThat(manager.tournament(members).getId()).isEqualTo("b");
        }
    }

    @Test
    void sameSeedReproducesGenerations() {
        Population a = runTwoGenerations(manager(0.5, 2, 3, 10));
        Population b = runTwoGenerations(manager(0.5, 2, 3, 10));

        assertThat(a.getGenotypes()).isEqualTo(b.getGenotypes());
        assertThat(a.getSpecies()).extracting(Species::members)
                .isEqualTo(b.getSpecies().stream().map(Species::members).toList());
    }

    private static Population runTwoGenerations(PopulationManager manager) {
        Population population = manager.initialize();
        for (int i = 0; i < 2; i++) {
            population = manager.nextGeneration(evaluate(population, g -> g.getConnections().size()));
        }
        return population;
    }

    private static void assertPartition(Population population) {
        Set<String> seen = new HashSet<>();
        for (Species species : population.getSpecies()) {
            assertThat(species.members()).isNotEmpty();
            for (String id : species.members()) {
                assertThat(seen.add(id)).as("genotype %s in two species", id).isTrue();
                assertThat(population.getGenotype(id)).hasValueSatisfying(
                        g -> assertThat(g.getSpeciesId()).isEqualTo(species.id()));
            }
        }
        assertThat(seen).hasSize(population.size());
    }
}
