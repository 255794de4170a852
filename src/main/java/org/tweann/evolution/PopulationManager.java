package org.tweann.evolution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Speciation and reproduction.
 * <p>
 * A generation step ({@link #nextGeneration(Population)}) takes an evaluated population and
 * <ol>
 *   <li>re-speciates it: first-match assignment against the species representatives in species
 *       order, new species for genotypes matching none, empty species dropped, adjusted fitness set
 *       to fitness divided by species size</li>
 *   <li>updates every species' age, best fitness and last improvement, flags stagnant species and
 *       picks a new random representative among its members</li>
 *   <li>allocates offspring in proportion to each species' mean raw fitness, uniformly if the
 *       total is zero</li>
 *   <li>breeds each species' share: its best member survives unmodified if the species is larger
 *       than {@code elitism-min-size}; the rest come from tournament selection followed by
 *       crossover (with probability {@code crossover-rate}, given two or more members) and mutation</li>
 *   <li>pads with fresh seed genotypes or truncates to restore the exact population size, and
 *       speciates the result</li>
 * </ol>
 * Stagnant species are reported in the generation's {@link GenerationSummary} only; they still
 * reproduce.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. All randomness comes from one stream.
 */
public class PopulationManager {

    private static final Logger log = LoggerFactory.getLogger(PopulationManager.class);

    private final PopulationConfig config;
    private final GenotypeConstructor constructor;
    private final GeneticOperators operators;
    private final Random random;

    public PopulationManager(PopulationConfig config, GenotypeConstructor constructor, GeneticOperators operators,
                             IRandomProvider randomProvider) {
        this.config = config;
        this.constructor = constructor;
        this.operators = operators;
        this.random = randomProvider.deriveFor("population", 0).asJavaRandom();
    }

    public PopulationConfig getConfig() {
        return config;
    }

    /**
     * Creates generation 0 from seed genotypes and speciates it.
     */
    public Population initialize() {
        List<Genotype> seeds = new ArrayList<>(config.size());
        for (int i = 0; i < config.size(); i++) {
            seeds.add(constructor.construct(genotypeId(0, i), 0, random));
        }
        Population population = speciate(new Population(0, seeds, List.of(), config, List.of(), 0));
        log.debug("Initialized population with {} genotypes in {} species", population.size(),
                population.getSpecies().size());
        return population;
    }

    /**
     * Partitions the population into species.
     * <p>
     * Each genotype joins the first species, in species order, whose representative is closer than
     * the compatibility threshold; otherwise it founds a new species. Species without members are
     * dropped. Every genotype's species id and adjusted fitness are updated.
     *
     * @param population The population to partition.
     * @return The same generation with a fresh partition.
     */
    public Population speciate(Population population) {
        List<Species> candidates = new ArrayList<>(population.getSpecies());
        List<List<String>> members = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            members.add(new ArrayList<>());
        }
        int nextSpeciesNumber = population.getNextSpeciesNumber();

        Map<String, Integer> assignment = new HashMap<>();
        for (Genotype genotype : population.getGenotypes()) {
            int match = -1;
            for (int s = 0; s < candidates.size(); s++) {
                if (operators.distance(genotype, candidates.get(s).representative()) < config.compatibilityThreshold()) {
                    match = s;
                    break;
                }
            }
            if (match < 0) {
                candidates.add(Species.founder("s-" + nextSpeciesNumber++, genotype, population.getGeneration()));
                members.add(new ArrayList<>());
                match = candidates.size() - 1;
            }
            members.get(match).add(genotype.getId());
            assignment.put(genotype.getId(), match);
        }

        List<Species> species = new ArrayList<>();
        for (int s = 0; s < candidates.size(); s++) {
            if (!members.get(s).isEmpty()) {
                species.add(candidates.get(s).withMembers(members.get(s)));
            }
        }

        List<Genotype> genotypes = new ArrayList<>(population.size());
        for (Genotype genotype : population.getGenotypes()) {
            int s = assignment.get(genotype.getId());
            int speciesSize = members.get(s).size();
            genotypes.add(genotype.toBuilder()
                    .speciesId(candidates.get(s).id())
                    .adjustedFitness(genotype.getFitness() / speciesSize)
                    .build());
        }

        return new Population(population.getGeneration(), genotypes, species, population.getConfig(),
                population.getHistory(), nextSpeciesNumber);
    }

    /**
     * Produces the next generation from an evaluated population.
     *
     * @param evaluated The current generation with fitness values.
     * @return The next generation, speciated, with exactly {@code size} genotypes.
     */
    public Population nextGeneration(Population evaluated) {
        Population current = speciate(evaluated);
        int generation = current.getGeneration();

        List<Species> updatedSpecies = new ArrayList<>();
        List<String> stagnant = new ArrayList<>();
        for (Species s : current.getSpecies()) {
            Species updated = updateAfterGeneration(s, current, generation);
            updatedSpecies.add(updated);
            if (updated.isStagnant(generation, config.stagnationThreshold())) {
                stagnant.add(updated.id());
            }
        }
        GenerationSummary summary = summarize(current, updatedSpecies.size(), stagnant);

        int[] allocation = allocateOffspring(current, updatedSpecies);
        List<Genotype> offspring = new ArrayList<>(config.size());
        int nextIndex = 0;
        for (int s = 0; s < updatedSpecies.size(); s++) {
            List<Genotype> members = sortedMembers(current, updatedSpecies.get(s));
            int count = allocation[s];
            if (count <= 0) continue;

            int produced = 0;
            if (members.size() > config.elitismMinSize()) {
                offspring.add(members.get(0));
                produced++;
            }
            while (produced < count) {
                offspring.add(breed(members, genotypeId(generation + 1, nextIndex++), generation + 1));
                produced++;
            }
        }

        while (offspring.size() < config.size()) {
            offspring.add(constructor.construct(genotypeId(generation + 1, nextIndex++), generation + 1, random));
        }
        if (offspring.size() > config.size()) {
            offspring = new ArrayList<>(offspring.subList(0, config.size()));
        }

        List<GenerationSummary> history = new ArrayList<>(current.getHistory());
        history.add(summary);
        log.debug("Generation {}: {} species ({} stagnant), allocation {}", generation, updatedSpecies.size(),
                stagnant.size(), allocation);

        Population next = new Population(generation + 1, offspring, updatedSpecies, config, history,
                current.getNextSpeciesNumber());
        return speciate(next);
    }

    /**
     * Computes how many offspring each species receives. Counts are rounded, so their sum may differ
     * from the population size; the caller pads or truncates.
     */
    int[] allocateOffspring(Population population, List<Species> species) {
        double[] means = new double[species.size()];
        double total = 0.0;
        for (int s = 0; s < species.size(); s++) {
            double sum = 0.0;
            for (String id : species.get(s).members()) {
                sum += Math.max(0.0, population.getGenotype(id).orElseThrow().getFitness());
            }
            means[s] = sum / species.get(s).size();
            total += means[s];
        }

        int[] allocation = new int[species.size()];
        for (int s = 0; s < species.size(); s++) {
            double share = total > 0.0 ? means[s] / total : 1.0 / species.size();
            allocation[s] = (int) Math.round(share * config.size());
        }
        return allocation;
    }

    /**
     * Samples {@code min(tournament-size, members)} distinct members and returns the fittest.
     */
    Genotype tournament(List<Genotype> members) {
        int k = Math.min(config.tournamentSize(), members.size());
        int[] indices = new int[members.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        Genotype winner = null;
        for (int i = 0; i < k; i++) {
            int pick = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[pick];
            indices[pick] = tmp;
            Genotype candidate = members.get(indices[i]);
            if (winner == null || candidate.getFitness() > winner.getFitness()) {
                winner = candidate;
            }
        }
        return winner;
    }

    private Genotype breed(List<Genotype> members, String childId, int generation) {
        Genotype first = tournament(members);
        Genotype child;
        if (members.size() >= 2 && random.nextDouble() < config.crossoverRate()) {
            Genotype second = tournament(members);
            child = operators.crossover(first, second, childId);
        } else {
            child = first.asOffspring(childId, generation);
        }
        return operators.mutate(child);
    }

    private Species updateAfterGeneration(Species species, Population population, int generation) {
        List<Genotype> members = sortedMembers(population, species);
        double generationBest = members.get(0).getFitness();
        double bestFitness = species.bestFitness();
        int lastImprovement = species.lastImprovementGeneration();
        if (generationBest > bestFitness) {
            bestFitness = generationBest;
            lastImprovement = generation;
        }
        Genotype representative = members.get(random.nextInt(members.size()));
        return new Species(species.id(), species.members(), representative, bestFitness, lastImprovement,
                species.age() + 1);
    }

    private GenerationSummary summarize(Population population, int speciesCount, List<String> stagnant) {
        double best = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        int failed = 0;
        for (Genotype genotype : population.getGenotypes()) {
            best = Math.max(best, genotype.getFitness());
            sum += genotype.getFitness();
            if (genotype.getStatus() == Genotype.EvaluationStatus.FAILED) {
                failed++;
            }
        }
        double mean = population.size() == 0 ? 0.0 : sum / population.size();
        return new GenerationSummary(population.getGeneration(), population.size() == 0 ? 0.0 : best, mean,
                speciesCount, stagnant, failed);
    }

    // Fittest first; the stable sort keeps population order among ties.
    private static List<Genotype> sortedMembers(Population population, Species species) {
        List<Genotype> members = new ArrayList<>(species.size());
        for (String id : species.members()) {
            members.add(population.getGenotype(id).orElseThrow());
        }
        members.sort(Comparator.comparingDouble(Genotype::getFitness).reversed());
        return members;
    }

    static String genotypeId(int generation, int index) {
        return "g-" + generation + "-" + index;
    }
}
