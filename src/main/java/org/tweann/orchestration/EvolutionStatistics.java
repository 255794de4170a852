package org.tweann.orchestration;

import java.util.ArrayList;
import java.util.List;

import org.tweann.evolution.GenerationSummary;

/**
 * Snapshot of a run's per-generation history and evaluation counters.
 *
 * @param history           One summary per completed generation, oldest first.
 * @param evaluations       Fitness evaluations performed so far.
 * @param failedEvaluations Evaluations that ended with status {@code FAILED}.
 */
public record EvolutionStatistics(List<GenerationSummary> history, long evaluations, long failedEvaluations) {

    public EvolutionStatistics {
        history = List.copyOf(history);
    }

    public static EvolutionStatistics empty() {
        return new EvolutionStatistics(List.of(), 0, 0);
    }

    public int generationsCompleted() {
        return history.size();
    }

    public List<Double> bestFitnessHistory() {
        List<Double> values = new ArrayList<>(history.size());
        for (GenerationSummary summary : history) {
            values.add(summary.bestFitness());
        }
        return values;
    }

    public List<Double> meanFitnessHistory() {
        List<Double> values = new ArrayList<>(history.size());
        for (GenerationSummary summary : history) {
            values.add(summary.meanFitness());
        }
        return values;
    }

    public List<Integer> speciesCountHistory() {
        List<Integer> values = new ArrayList<>(history.size());
        for (GenerationSummary summary : history) {
            values.add(summary.speciesCount());
        }
        return values;
    }
}
