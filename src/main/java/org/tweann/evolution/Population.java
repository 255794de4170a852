package org.tweann.evolution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.tweann.genotype.Genotype;

/**
 * One generation of genotypes with its species partition and the statistics of all generations so
 * far.
 * <p>
 * Genotypes are held in an arena keyed by id, in a stable order that speciation and reproduction
 * rely on for determinism. Populations are immutable; every transition returns a new instance.
 */
public final class Population {

    private final int generation;
    private final Map<String, Genotype> genotypes;
    private final List<Species> species;
    private final PopulationConfig config;
    private final List<GenerationSummary> history;
    private final int nextSpeciesNumber;

    public Population(int generation, Collection<Genotype> genotypes, List<Species> species,
                      PopulationConfig config, List<GenerationSummary> history, int nextSpeciesNumber) {
        Map<String, Genotype> arena = new LinkedHashMap<>();
        for (Genotype genotype : genotypes) {
            if (arena.put(genotype.getId(), genotype) != null) {
                throw new IllegalArgumentException("Duplicate genotype id in population: " + genotype.getId());
            }
        }
        this.generation = generation;
        this.genotypes = Collections.unmodifiableMap(arena);
        this.species = List.copyOf(species);
        this.config = config;
        this.history = List.copyOf(history);
        this.nextSpeciesNumber = nextSpeciesNumber;
    }

    public int getGeneration() {
        return generation;
    }

    /**
     * Returns the genotypes in population order.
     */
    public List<Genotype> getGenotypes() {
        return new ArrayList<>(genotypes.values());
    }

    public Optional<Genotype> getGenotype(String id) {
        return Optional.ofNullable(genotypes.get(id));
    }

    public int size() {
        return genotypes.size();
    }

    public List<Species> getSpecies() {
        return species;
    }

    public PopulationConfig getConfig() {
        return config;
    }

    /**
     * Returns the per-generation statistics, oldest first.
     */
    public List<GenerationSummary> getHistory() {
        return history;
    }

    int getNextSpeciesNumber() {
        return nextSpeciesNumber;
    }

    /**
     * Returns the genotypes that still need a fitness value.
     */
    public List<Genotype> getUnevaluated() {
        List<Genotype> result = new ArrayList<>();
        for (Genotype genotype : genotypes.values()) {
            if (!genotype.isEvaluated()) {
                result.add(genotype);
            }
        }
        return result;
    }

    /**
     * Returns the evaluated genotype with the highest fitness; the earliest one wins ties.
     */
    public Optional<Genotype> getBest() {
        Genotype best = null;
        for (Genotype genotype : genotypes.values()) {
            if (genotype.isEvaluated() && (best == null || genotype.getFitness() > best.getFitness())) {
                best = genotype;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Replaces genotypes by id, keeping population order.
     *
     * @param updated Genotypes whose ids are already in the population.
     * @return The updated population.
     * @throws IllegalArgumentException if a genotype id is not part of this population.
     */
    public Population withGenotypes(Collection<Genotype> updated) {
        Map<String, Genotype> arena = new LinkedHashMap<>(genotypes);
        for (Genotype genotype : updated) {
            if (!arena.containsKey(genotype.getId())) {
                throw new IllegalArgumentException("Genotype " + genotype.getId() + " is not part of generation "
                        + generation);
            }
            arena.put(genotype.getId(), genotype);
        }
        return new Population(generation, arena.values(), species, config, history, nextSpeciesNumber);
    }

    @Override
    public String toString() {
        return "Population{generation=" + generation + ", size=" + genotypes.size() + ", species=" + species.size() + "}";
    }
}
