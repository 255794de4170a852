package org.tweann.orchestration;

import org.tweann.evolution.GenerationSummary;
import org.tweann.genotype.Genotype;

/**
 * Result of one {@link EvolutionEngine#step()}.
 *
 * @param summary The evaluated generation's statistics.
 * @param best    The generation's fittest evaluated genotype.
 */
public record GenerationReport(GenerationSummary summary, Genotype best) {

    public int generation() {
        return summary.generation();
    }
}
