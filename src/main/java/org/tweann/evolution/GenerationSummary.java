package org.tweann.evolution;

import java.util.List;

/**
 * Statistics of one evaluated generation.
 *
 * @param generation        Generation number.
 * @param bestFitness       Best raw fitness.
 * @param meanFitness       Mean raw fitness.
 * @param speciesCount      Number of species after speciation.
 * @param stagnantSpecies   Ids of the species flagged as stagnant.
 * @param failedEvaluations Number of genotypes whose evaluation failed.
 */
public record GenerationSummary(int generation, double bestFitness, double meanFitness, int speciesCount,
                                List<String> stagnantSpecies, int failedEvaluations) {

    public GenerationSummary {
        stagnantSpecies = List.copyOf(stagnantSpecies);
    }
}
